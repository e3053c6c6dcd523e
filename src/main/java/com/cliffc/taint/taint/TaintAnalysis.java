package com.cliffc.taint.taint;

import com.cliffc.taint.domain.Label;
import com.cliffc.taint.domain.ProductDomain;
import com.cliffc.taint.domain.Tree;
import com.cliffc.taint.fixpoint.Analysis;
import com.cliffc.taint.fixpoint.Target;
import com.cliffc.taint.ir.Define;
import com.cliffc.taint.ir.Expr;
import com.cliffc.taint.ir.Program;
import com.cliffc.taint.ir.Stmt;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.function.Function;

/** Interprocedural taint analysis of one callable against its callees' models.

    The forward pass tracks source taint from calls to the return value and
    reports an {@link Issue} wherever an argument carrying sources reaches a
    callee's sinks under a rule.  The backward pass starts from the return
    value and the callees' sinks and finds, per parameter, the sinks it
    reaches and the parts of the return value it flows into.

    Callees are seen only through their models.  An obscure callee passes
    every argument's taint to its result, with the obscure breadcrumb.
 */
public class TaintAnalysis implements Analysis<Model,List<Issue>> {
  final TaintDomains _d;
  final TaintConfig _config;
  final Program _program;
  final Map<Target,Model> _declared;
  final List<Rule> _rules;
  final Logger _log;

  public TaintAnalysis( TaintDomains d, Program program, Map<Target,Model> declared ) {
    this(d,program,declared,LogManager.getLogger(TaintAnalysis.class));
  }
  public TaintAnalysis( TaintDomains d, Program program, Map<Target,Model> declared, Logger log ) {
    _d = d;
    _config = d._config;
    _program = program;
    _declared = declared;
    _rules = d._config.active_rules();
    _log = log;
  }

  @Override public ProductDomain<Model> model_domain() { return _d.MODEL; }
  @Override public List<Issue> empty_result() { return List.of(); }
  @Override public Model widen( int iteration, Model previous, Model next ) {
    return _d.widen(_config._widen_policy,iteration,previous,next);
  }

  @Override public Analyzed<Model,List<Issue>> analyze( Target callable, Model previous, Function<Target,Model> callee_models ) {
    Define d = _program.define(callable);
    if( d==null || d.is_stub() ) throw new IllegalStateException("No body to analyze for "+callable);
    Forward fwd = new Forward(callable,callee_models);
    fwd.run(d);
    Backward bwd = new Backward(callee_models);
    bwd.run(d);
    Model inferred = new Model(fwd._returned,bwd._sinks,bwd._tito,_d.MODES.bottom());
    Model declared = _declared.get(callable);
    Model model = declared==null ? inferred : _d.MODEL.join(declared,inferred);
    List<Issue> issues = fwd.issues();
    _log.debug("Analyzed {}: {} issues", callable, issues.size());
    if( _log.isTraceEnabled() ) _log.trace("Model of {}: {}", callable, _d.show(model));
    return new Analyzed<>(model,issues);
  }

  // Parameter name at a call position; positional for unknown callees
  private String param( Target callee, int i ) {
    Define d = _program.define(callee);
    return d==null || i >= d._params.size() ? Integer.toString(i) : d._params.get(i);
  }
  private Model model( Function<Target,Model> models, Target callee ) {
    Model m = models.apply(callee);
    return m==null ? _d.MODEL.bottom() : m;
  }

  // ----------------------------------------------------------
  private final class Forward {
    final Target _callable;
    final Function<Target,Model> _models;
    final HashMap<String,Tree<Map<Kind,FlowDetails>>> _env = new HashMap<>();
    final TreeMap<String,Issue> _issues = new TreeMap<>();
    Tree<Map<Kind,FlowDetails>> _returned = _d.TREE.bottom();

    Forward( Target callable, Function<Target,Model> models ) { _callable = callable; _models = models; }

    void run( Define d ) {
      for( Stmt s : d._body ) {
        Tree<Map<Kind,FlowDetails>> t = eval(s._expr);
        if( s instanceof Stmt.Assign a ) _env.put("$"+a._local,t);
        else if( s instanceof Stmt.Return ) _returned = _d.TREE.join(_returned,t);
      }
    }

    List<Issue> issues() {
      ArrayList<Issue> is = new ArrayList<>(_issues.values());
      Collections.sort(is);
      return is;
    }

    Tree<Map<Kind,FlowDetails>> eval( Expr e ) {
      if( e instanceof Expr.Param p ) return _env.getOrDefault(p._name,_d.TREE.bottom());
      if( e instanceof Expr.Local l ) return _env.getOrDefault("$"+l._name,_d.TREE.bottom());
      if( e instanceof Expr.Literal ) return _d.TREE.bottom();
      if( e instanceof Expr.Attribute a ) return _d.TREE.read(Label.path(a._field),eval(a._base));
      if( e instanceof Expr.Record r ) {
        Tree<Map<Kind,FlowDetails>> t = _d.TREE.bottom();
        for( Map.Entry<String,Expr> f : r._fields.entrySet() )
          t = _d.TREE.join(t,_d.TREE.prepend(Label.path(f.getKey()),eval(f.getValue())));
        return t;
      }
      if( e instanceof Expr.Call c ) return call(c);
      throw new IllegalStateException("Unknown expression "+e);
    }

    Tree<Map<Kind,FlowDetails>> call( Expr.Call c ) {
      Model cm = model(_models,c._callee);
      Tree<Map<Kind,FlowDetails>> result = _d.apply_call(cm._sources,c._callee,"result",c._line);
      for( int i=0; i<c._args.size(); i++ ) {
        String p = param(c._callee,i);
        Tree<Map<Kind,FlowDetails>> arg = eval(c._args.get(i));
        if( _d.TREE.is_bottom(arg) ) continue;
        check_flows(c,arg,_d.SINKS.get(cm._sinks,p));
        Tree<Map<Kind,FlowDetails>> tito = _d.TITO.get(cm._tito,p);
        if( !_d.TREE.is_bottom(tito) )
          result = _d.TREE.join(result,_d.add_feature(propagate_tito(arg,tito),Feature.TITO));
        if( cm.is_obscure() )
          result = _d.TREE.join(result,_d.add_feature(_d.TREE.create_leaf(_d.TREE.collapse(arg)),Feature.OBSCURE));
      }
      return result;
    }

    // Sources in the argument, moved to where the callee returns them
    Tree<Map<Kind,FlowDetails>> propagate_tito( Tree<Map<Kind,FlowDetails>> arg, Tree<Map<Kind,FlowDetails>> tito ) {
      return _d.TREE.fold_tree_paths(tito,_d.TREE.bottom(),(input,anc,element,acc) -> {
          Tree<Map<Kind,FlowDetails>> in = _d.TREE.read(input,arg);
          for( ReturnAccessPath rap : _d.return_paths(element) )
            acc = _d.TREE.join(acc,_d.TREE.prepend(rap._path,in));
          return acc;
        });
    }

    void check_flows( Expr.Call c, Tree<Map<Kind,FlowDetails>> sources, Tree<Map<Kind,FlowDetails>> sinks ) {
      for( Match m : generate_source_sink_matches(sources,sinks) )
        for( Rule r : _rules ) {
          Set<Kind> srcs = intersect(m._sources,r._sources);
          Set<Kind> snks = intersect(m._sinks,r._sinks);
          if( srcs.isEmpty() || snks.isEmpty() ) continue;
          Issue issue = new Issue(r,_callable,c._callee,c._line,srcs,snks);
          _issues.merge(issue.handle(),issue,Issue::join);
        }
    }
  }

  /** Source and sink kinds meeting at one access path. */
  static final class Match {
    final Set<Kind> _sources, _sinks;
    Match( Set<Kind> sources, Set<Kind> sinks ) { _sources = sources; _sinks = sinks; }
    @Override public String toString() { return _sources+" -> "+_sinks; }
  }

  /** Every sink path, with the sources readable at that path. */
  List<Match> generate_source_sink_matches( Tree<Map<Kind,FlowDetails>> sources, Tree<Map<Kind,FlowDetails>> sinks ) {
    ArrayList<Match> ms = new ArrayList<>();
    if( _d.TREE.is_bottom(sources) || _d.TREE.is_bottom(sinks) ) return ms;
    _d.TREE.fold_tree_paths(sinks,ms,(path,anc,sink,acc) -> {
        Map<Kind,FlowDetails> src = _d.TREE.collapse(_d.TREE.read(path,sources));
        Set<Kind> srcs = _d.kinds(src);
        srcs.removeIf(k -> !_config.is_source(k));
        Set<Kind> snks = _d.kinds(sink);
        snks.removeIf(k -> !_config.is_sink(k));
        if( !srcs.isEmpty() && !snks.isEmpty() ) acc.add(new Match(srcs,snks));
        return acc;
      });
    return ms;
  }

  private static Set<Kind> intersect( Set<Kind> a, Set<Kind> b ) {
    TreeSet<Kind> res = new TreeSet<>(a);
    res.retainAll(b);
    return res;
  }

  // ----------------------------------------------------------
  private final class Backward {
    final Function<Target,Model> _models;
    final HashMap<String,Tree<Map<Kind,FlowDetails>>> _env = new HashMap<>();
    Map<String,Tree<Map<Kind,FlowDetails>>> _sinks = _d.SINKS.bottom();
    Map<String,Tree<Map<Kind,FlowDetails>>> _tito = _d.TITO.bottom();

    Backward( Function<Target,Model> models ) { _models = models; }

    void run( Define d ) {
      for( int i=d._body.size()-1; i>=0; i-- ) {
        Stmt s = d._body.get(i);
        Tree<Map<Kind,FlowDetails>> t;
        if( s instanceof Stmt.Return ) t = _d.local_return(List.of());
        else if( s instanceof Stmt.Assign a ) { t = _env.remove("$"+a._local); if( t==null ) t = _d.TREE.bottom(); }
        else t = _d.TREE.bottom();
        backward(s._expr,t);
      }
      for( String p : d._params ) {
        Tree<Map<Kind,FlowDetails>> t = _env.get(p);
        if( t==null ) continue;
        _sinks = _d.SINKS.set(_sinks,p,_d.filter_kinds(t,k -> !k.equals(Kind.LOCAL_RETURN)));
        _tito  = _d.TITO .set(_tito ,p,_d.filter_kinds(t,k -> k.equals(Kind.LOCAL_RETURN)));
      }
    }

    void backward( Expr e, Tree<Map<Kind,FlowDetails>> t ) {
      if( e instanceof Expr.Param p ) { flows_into(p._name,t); return; }
      if( e instanceof Expr.Local l ) { flows_into("$"+l._name,t); return; }
      if( e instanceof Expr.Literal ) return;
      if( e instanceof Expr.Attribute a ) { backward(a._base,_d.TREE.prepend(Label.path(a._field),t)); return; }
      if( e instanceof Expr.Record r ) {
        for( Map.Entry<String,Expr> f : r._fields.entrySet() )
          backward(f.getValue(),_d.TREE.read(Label.path(f.getKey()),t,_d::extend_return_paths));
        return;
      }
      if( e instanceof Expr.Call c ) { call(c,t); return; }
      throw new IllegalStateException("Unknown expression "+e);
    }

    void flows_into( String name, Tree<Map<Kind,FlowDetails>> t ) {
      if( _d.TREE.is_bottom(t) ) return;
      _env.merge(name,t,_d.TREE::join);
    }

    void call( Expr.Call c, Tree<Map<Kind,FlowDetails>> result ) {
      Model cm = model(_models,c._callee);
      for( int i=0; i<c._args.size(); i++ ) {
        String p = param(c._callee,i);
        Tree<Map<Kind,FlowDetails>> t = _d.apply_call(_d.SINKS.get(cm._sinks,p),c._callee,p,c._line);
        Tree<Map<Kind,FlowDetails>> tito = _d.TITO.get(cm._tito,p);
        if( !_d.TREE.is_bottom(tito) && !_d.TREE.is_bottom(result) )
          t = _d.TREE.join(t,_d.add_feature(backward_tito(result,tito),Feature.TITO));
        if( cm.is_obscure() && !_d.TREE.is_bottom(result) )
          t = _d.TREE.join(t,_d.add_feature(_d.TREE.create_leaf(_d.TREE.collapse(result)),Feature.OBSCURE));
        backward(c._args.get(i),t);
      }
    }

    // What the call result reaches, seen from the argument: read each
    // returned path and place it at the argument path it came from.
    Tree<Map<Kind,FlowDetails>> backward_tito( Tree<Map<Kind,FlowDetails>> result, Tree<Map<Kind,FlowDetails>> tito ) {
      return _d.TREE.fold_tree_paths(tito,_d.TREE.bottom(),(input,anc,element,acc) -> {
          for( ReturnAccessPath rap : _d.return_paths(element) ) {
            Tree<Map<Kind,FlowDetails>> out = _d.TREE.read(rap._path,result,_d::extend_return_paths);
            acc = _d.TREE.join(acc,_d.TREE.prepend(input,_d.TREE.create_leaf(_d.TREE.collapse(out))));
          }
          return acc;
        });
    }
  }
}
