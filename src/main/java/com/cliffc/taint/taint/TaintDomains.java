package com.cliffc.taint.taint;

import com.cliffc.taint.domain.*;
import com.cliffc.taint.domain.OverUnderSetDomain.OverUnder;
import com.cliffc.taint.domain.ProductDomain.Slot;
import com.cliffc.taint.fixpoint.Target;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.Predicate;

/** The taint lattices of one run, built from its configuration.

    <pre>
    Model    = Product(sources: Tree, sinks: Map(param -> Tree), tito: Map(param -> Tree), modes: Set(Mode))
    Tree     = Tree(Taint), depth bounded after widening
    Taint    = Map(Kind -> FlowDetails)
    FlowDetails = Product(trace (strict): Set(TraceInfo), simple: OverUnder(Feature), complex: Set(ReturnAccessPath))
    </pre>
 */
public final class TaintDomains {
  public final TaintConfig _config;

  public final ElementSetDomain<TraceInfo> TRACE;
  public final OverUnderSetDomain<Feature> SIMPLE;
  public final ElementSetDomain<ReturnAccessPath> COMPLEX;
  public final Slot<FlowDetails,Set<TraceInfo>> TRACE_SLOT;
  public final Slot<FlowDetails,OverUnder<Feature>> SIMPLE_SLOT;
  public final Slot<FlowDetails,Set<ReturnAccessPath>> COMPLEX_SLOT;
  public final ProductDomain<FlowDetails> FLOW;
  public final MapDomain<Kind,FlowDetails> TAINT;
  public final TreeDomain<Map<Kind,FlowDetails>> TREE;
  public final MapDomain<String,Tree<Map<Kind,FlowDetails>>> SINKS;
  public final MapDomain<String,Tree<Map<Kind,FlowDetails>>> TITO;
  public final ElementSetDomain<Model.Mode> MODES;
  public final Slot<Model,Tree<Map<Kind,FlowDetails>>> SOURCES_SLOT;
  public final Slot<Model,Map<String,Tree<Map<Kind,FlowDetails>>>> SINKS_SLOT;
  public final Slot<Model,Map<String,Tree<Map<Kind,FlowDetails>>>> TITO_SLOT;
  public final Slot<Model,Set<Model.Mode>> MODES_SLOT;
  public final ProductDomain<Model> MODEL;

  // Parts of a taint value, reaching into every flow
  public final Part<Map<Kind,FlowDetails>,Set<TraceInfo>> TRACES;
  public final Part<Map<Kind,FlowDetails>,Feature> FEATURE;
  public final Part<Map<Kind,FlowDetails>,ReturnAccessPath> RETURN_PATH;
  // The same, at every node of a tree
  public final Part<Tree<Map<Kind,FlowDetails>>,Map<Kind,FlowDetails>> TREE_TAINT;
  public final Part<Tree<Map<Kind,FlowDetails>>,Kind> TREE_KIND;
  public final Part<Tree<Map<Kind,FlowDetails>>,Set<TraceInfo>> TREE_TRACES;
  // For building flows
  private final Part<FlowDetails,TraceInfo> FLOW_TRACE;
  private final Part<FlowDetails,OverUnder<Feature>> FLOW_SIMPLE;
  private final Part<FlowDetails,ReturnAccessPath> FLOW_RETURN_PATH;

  public TaintDomains( TaintConfig config ) { this(config,LogManager.getLogger(TaintDomains.class)); }
  public TaintDomains( TaintConfig config, Logger log ) {
    _config = config;
    TRACE = new ElementSetDomain<>("Trace");
    SIMPLE = new OverUnderSetDomain<>("SimpleFeatures");
    COMPLEX = new ElementSetDomain<>("ComplexFeatures",ReturnAccessPath::less_or_equal,
                                     config._max_return_access_path_width,ReturnAccessPath.ROOT,
                                     rap -> rap.truncate(config._max_return_access_path_length),log);
    TRACE_SLOT   = Slot.strict("trace",TRACE,f -> f._trace,FlowDetails::with_trace);
    SIMPLE_SLOT  = Slot.of("simple",SIMPLE,f -> f._simple,FlowDetails::with_simple);
    COMPLEX_SLOT = Slot.of("complex",COMPLEX,f -> f._complex,FlowDetails::with_complex);
    FLOW = new ProductDomain<>("FlowDetails",new FlowDetails(TRACE.bottom(),SIMPLE.bottom(),COMPLEX.bottom()),
                               TRACE_SLOT,SIMPLE_SLOT,COMPLEX_SLOT);
    TAINT = new MapDomain<>("Taint",FLOW);
    TREE = new TreeDomain<>("TaintTree",TAINT,config._max_tree_depth_after_widening,log);
    SINKS = new MapDomain<>("Sinks",TREE);
    TITO = new MapDomain<>("Tito",TREE);
    MODES = new ElementSetDomain<>("Modes");
    SOURCES_SLOT = Slot.of("sources",TREE,m -> m._sources,Model::with_sources);
    SINKS_SLOT   = Slot.of("sinks",SINKS,m -> m._sinks,Model::with_sinks);
    TITO_SLOT    = Slot.of("tito",TITO,m -> m._tito,Model::with_tito);
    MODES_SLOT   = Slot.of("modes",MODES,m -> m._modes,Model::with_modes);
    MODEL = new ProductDomain<>("Model",new Model(TREE.bottom(),SINKS.bottom(),TITO.bottom(),MODES.bottom()),
                                SOURCES_SLOT,SINKS_SLOT,TITO_SLOT,MODES_SLOT);

    FLOW_TRACE       = FLOW.lift(TRACE_SLOT,TRACE.ELEMENT);
    FLOW_SIMPLE      = FLOW.lift(SIMPLE_SLOT,SIMPLE.SELF);
    FLOW_RETURN_PATH = FLOW.lift(COMPLEX_SLOT,COMPLEX.ELEMENT);
    TRACES      = TAINT.lift(FLOW.lift(TRACE_SLOT,TRACE.SELF));
    FEATURE     = TAINT.lift(FLOW.lift(SIMPLE_SLOT,SIMPLE.ELEMENT));
    RETURN_PATH = TAINT.lift(FLOW_RETURN_PATH);
    TREE_TAINT  = TREE.lift(TAINT.SELF);
    TREE_KIND   = TREE.lift(TAINT.KEY);
    TREE_TRACES = TREE.lift(TRACES);
  }

  // ----------------------------------------------------------
  /** A single flow of kind k. */
  public Map<Kind,FlowDetails> flow( Kind k, TraceInfo trace ) {
    return TAINT.singleton(k,FLOW.create(PartValue.of(FLOW_TRACE,trace),
                                         PartValue.of(FLOW_SIMPLE,SIMPLE.empty())));
  }
  public Tree<Map<Kind,FlowDetails>> leaf( Kind k, TraceInfo trace ) { return TREE.create_leaf(flow(k,trace)); }

  /** Marks a value flowing into the return value at path. */
  public Tree<Map<Kind,FlowDetails>> local_return( List<Label> path ) {
    return TREE.create_leaf(TAINT.singleton(Kind.LOCAL_RETURN,
                                            FLOW.create(PartValue.of(FLOW_TRACE,TraceInfo.DECLARATION),
                                                        PartValue.of(FLOW_SIMPLE,SIMPLE.empty()),
                                                        PartValue.of(FLOW_RETURN_PATH,ReturnAccessPath.of(path)))));
  }

  /** Taint as seen from a caller: every flow now comes from the call site. */
  public @NotNull Tree<Map<Kind,FlowDetails>> apply_call( Tree<Map<Kind,FlowDetails>> t, Target callee, String port, int line ) {
    Set<TraceInfo> site = TRACE.singleton(TraceInfo.call_site(callee,port,line));
    return TREE.transform(TREE_TRACES,Transform.map(old -> site),t);
  }

  /** Add a breadcrumb to every flow in the tree. */
  public Tree<Map<Kind,FlowDetails>> add_feature( Tree<Map<Kind,FlowDetails>> t, Feature f ) {
    return TREE.transform(TREE_TAINT,Transform.map(taint -> FEATURE.add(taint,f)),t);
  }

  /** Extend every return access path by the remaining path, bounded in length. */
  public Map<Kind,FlowDetails> extend_return_paths( List<Label> rest, Map<Kind,FlowDetails> taint ) {
    return RETURN_PATH.map(taint,rap -> rap.extend(rest,_config._max_return_access_path_length));
  }

  public Tree<Map<Kind,FlowDetails>> filter_kinds( Tree<Map<Kind,FlowDetails>> t, Predicate<Kind> p ) {
    return TREE.transform(TREE_KIND,Transform.filter(p),t);
  }

  public Set<Kind> kinds( Map<Kind,FlowDetails> taint ) {
    return TAINT.fold(TAINT.KEY,(k,acc) -> { acc.add(k); return acc; },new TreeSet<Kind>(),taint);
  }
  public Set<ReturnAccessPath> return_paths( Map<Kind,FlowDetails> taint ) {
    return TAINT.fold(RETURN_PATH,(rap,acc) -> { acc.add(rap); return acc; },new TreeSet<ReturnAccessPath>(),taint);
  }

  // ----------------------------------------------------------
  /** Widen two models, applying the tree policy to every tree. */
  public Model widen( TreeDomain.WidenPolicy policy, int iteration, Model prev, Model next ) {
    if( MODEL.is_bottom(prev) ) return next;
    if( MODEL.is_bottom(next) ) return prev;
    return new Model(TREE.widen(policy,iteration,prev._sources,next._sources),
                     widen_ports(SINKS,policy,iteration,prev._sinks,next._sinks),
                     widen_ports(TITO,policy,iteration,prev._tito,next._tito),
                     MODES.widen(iteration,prev._modes,next._modes));
  }
  private Map<String,Tree<Map<Kind,FlowDetails>>> widen_ports( MapDomain<String,Tree<Map<Kind,FlowDetails>>> dom, TreeDomain.WidenPolicy policy, int iteration,
                                                              Map<String,Tree<Map<Kind,FlowDetails>>> prev, Map<String,Tree<Map<Kind,FlowDetails>>> next ) {
    Map<String,Tree<Map<Kind,FlowDetails>>> res = prev;
    TreeSet<String> ports = new TreeSet<>(prev.keySet());
    ports.addAll(next.keySet());
    for( String p : ports )
      res = dom.set(res,p,TREE.widen(policy,iteration,dom.get(prev,p),dom.get(next,p)));
    return res;
  }

  public String show( Model m ) { return MODEL.show(m); }
}
