package com.cliffc.taint.fixpoint;

import com.cliffc.taint.domain.Domain;
import com.cliffc.taint.sched.Scheduler;
import com.cliffc.taint.util.SB;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/** Iterates an {@link Analysis} over a {@link DependencyGraph} until no
    callable's model changes.

    Every iteration analyzes the dirty callables in parallel buckets.  Workers
    only read models committed by earlier iterations and write the pending
    model of the callable they analyze, so an iteration's outcome does not
    depend on bucket scheduling.  After the iteration the pending models are
    committed, and a callable whose model grew marks itself and its
    dependencies dirty for the next round.

    A model only grows: a candidate that is {@code less_or_equal} to the
    previous model keeps the previous model and leaves the callable clean;
    otherwise the two are widened together.  The run stops when nothing is
    dirty ({@link FixpointState.Status#CONVERGED}) or after
    {@code max_iterations} rounds ({@link FixpointState.Status#CAPPED}).
 */
public class Fixpoint<M,R> {
  public static final int PREDEFINED = 0;   // Epoch of models given up front
  public static final int INITIAL = 1;      // Epoch of a first full run

  final Analysis<M,R> _analysis;
  final Domain<M> _dom;
  final Logger _log;

  public Fixpoint( Analysis<M,R> analysis ) { this(analysis,LogManager.getLogger(Fixpoint.class)); }
  public Fixpoint( Analysis<M,R> analysis, Logger log ) {
    _analysis = analysis;
    _dom = analysis.model_domain();
    _log = log;
  }

  /** Seed the model table: the given models are predefined, every callable
   *  to analyze without one starts at bottom. */
  public SharedModels<M> record_initial_models( Map<Target,M> initial, DependencyGraph graph ) {
    SharedModels<M> models = new SharedModels<>();
    for( Map.Entry<Target,M> e : initial.entrySet() )
      models.add(e.getKey(),e.getValue());
    for( Target t : graph.callables_to_analyze() )
      if( !models.contains(t) )
        models.add(t,_dom.bottom());
    return models;
  }

  public FixpointState<M,R> compute( Scheduler sched, DependencyGraph graph, Map<Target,M> initial, int max_iterations ) {
    return compute(sched,graph,record_initial_models(initial,graph),graph.callables_to_analyze(),max_iterations,INITIAL);
  }

  /** Run to a fixpoint, starting with callables dirty. */
  public @NotNull FixpointState<M,R> compute( Scheduler sched, DependencyGraph graph, SharedModels<M> models, List<Target> dirty, int max_iterations, int epoch ) {
    if( max_iterations < 1 ) throw new IllegalArgumentException("max_iterations must be positive: "+max_iterations);
    FixpointState<M,R> state = new FixpointState<>(epoch,models,_analysis.empty_result());
    List<Target> all = graph.callables_to_analyze();
    List<Target> todo = dirty;
    int iteration = 0;
    while( true ) {
      if( todo.isEmpty() ) { state._status = FixpointState.Status.CONVERGED; break; }
      if( iteration >= max_iterations ) {
        _log.warn("Fixpoint capped after {} iterations, {} callables still dirty", iteration, todo.size());
        state._status = FixpointState.Status.CAPPED;
        break;
      }
      _log.info("Iteration #{}, {} callables [{}]", iteration+1, todo.size(), preview(todo));
      long t0 = System.currentTimeMillis();
      final int iter = iteration;
      int changed = sched.map_reduce(0,
                                     (List<Target> bucket) -> one_analysis_pass(state,graph,iter,bucket),
                                     Integer::sum,
                                     todo);
      state._models.commit();
      todo = reanalyze(graph,all,todo,state);
      _log.info("Iteration #{} done in {}ms, {} models changed", iteration+1, System.currentTimeMillis()-t0, changed);
      iteration++;
    }
    state._iterations = iteration;
    return state;
  }

  // Runs on a worker: analyze one bucket, return how many models changed
  private int one_analysis_pass( FixpointState<M,R> state, DependencyGraph graph, int iteration, List<Target> bucket ) {
    int changed = 0;
    for( Target t : bucket )
      if( analyze_callable(state,graph,iteration,t) )
        changed++;
    _log.trace("Bucket of {} callables done, {} changed", bucket.size(), changed);
    return changed;
  }

  private boolean analyze_callable( FixpointState<M,R> state, DependencyGraph graph, int iteration, Target t ) {
    FixpointState.Meta meta = state._metas.get(t);
    if( meta != null && meta._epoch != state._epoch )
      throw new IllegalStateException("Fixpoint inconsistency: "+t+" has epoch "+meta._epoch+", expected "+state._epoch);
    M previous = state._models.get(t);
    if( previous==null ) throw new IllegalStateException("No initial model found for "+t);
    M model;
    R result;
    if( t.is_override() ) {
      model = override_model(state,graph,t);
      result = _analysis.empty_result();
    } else {
      try {
        Analysis.Analyzed<M,R> a = _analysis.analyze(t,previous,callee -> callee_model(state,callee));
        model = a._model;
        result = a._result;
      } catch( RuntimeException e ) {
        _log.warn("Analysis of {} failed in iteration {}, keeping previous model", t, iteration+1, e);
        state._errors.put(t,e);
        model = previous;
        result = state.get_result(t);
      }
    }
    boolean partial = !_dom.less_or_equal(model,previous);
    M next = widen_if_necessary(iteration,previous,model);
    state._models.put_pending(t,next);
    state._results.put(t,result);
    state._metas.put(t,new FixpointState.Meta(partial,state._epoch,iteration));
    return partial;
  }

  /** The model kept after an iteration: the previous model if the candidate
   *  adds nothing, else the widening of both. */
  public M widen_if_necessary( int iteration, M previous, M candidate ) {
    return _dom.less_or_equal(candidate,previous) ? previous : _analysis.widen(iteration,previous,candidate);
  }

  // Join of the base method and every overriding method
  private M override_model( FixpointState<M,R> state, DependencyGraph graph, Target over ) {
    Target base = over.corresponding_method();
    M acc = callee_model(state,base);
    for( Target o : graph.overrides_of(base) )
      acc = _dom.join(acc,callee_model(state,o));
    return acc;
  }

  // Callee without a model contributes nothing
  private M callee_model( FixpointState<M,R> state, Target callee ) {
    M m = state._models.get(callee);
    return m==null ? _dom.bottom() : m;
  }

  // Dirty callables and their dependencies, in the original order
  private List<Target> reanalyze( DependencyGraph graph, List<Target> all, List<Target> previous, FixpointState<M,R> state ) {
    HashSet<Target> dirty = new HashSet<>();
    for( Target t : previous ) {
      FixpointState.Meta meta = state._metas.get(t);
      if( meta != null && meta._partial ) {
        dirty.add(t);
        dirty.addAll(graph.dependencies(t));
      }
    }
    // Dependencies without a body have nothing to re-analyze
    ArrayList<Target> res = new ArrayList<>();
    for( Target t : all )
      if( dirty.contains(t) )
        res.add(t);
    return res;
  }

  private static String preview( List<Target> ts ) {
    SB sb = new SB().p(ts.subList(0,Math.min(5,ts.size())),", ");
    if( ts.size() > 5 ) sb.p(", ...");
    return sb.toString();
  }
}
