package com.cliffc.taint.fixpoint;

import org.jctools.maps.NonBlockingHashMap;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.Map;

/** Everything a fixpoint run leaves behind: models, per-callable results
 *  and errors, and the iteration count. */
public final class FixpointState<M,R> {
  public enum Status { RUNNING, CONVERGED, CAPPED }

  /** Per-callable bookkeeping. */
  public static final class Meta {
    public final boolean _partial;    // Model changed in the iteration that wrote it
    public final int _epoch;
    public final int _iteration;
    Meta( boolean partial, int epoch, int iteration ) { _partial = partial; _epoch = epoch; _iteration = iteration; }
    @Override public String toString() { return (_partial ? "partial" : "clean")+"@"+_epoch+":"+_iteration; }
  }

  public final int _epoch;
  final SharedModels<M> _models;
  final NonBlockingHashMap<Target,R> _results = new NonBlockingHashMap<>();
  final NonBlockingHashMap<Target,Meta> _metas = new NonBlockingHashMap<>();
  final NonBlockingHashMap<Target,Throwable> _errors = new NonBlockingHashMap<>();
  private final R _empty_result;
  Status _status = Status.RUNNING;
  int _iterations;

  FixpointState( int epoch, SharedModels<M> models, R empty_result ) {
    _epoch = epoch;
    _models = models;
    _empty_result = empty_result;
  }

  /** The final model of a callable, or null if it was never recorded. */
  public M get_model( Target t ) { return _models.get(t); }
  /** Latest result of a callable; the empty result if it never ran. */
  public @NotNull R get_result( Target t ) { return _results.getOrDefault(t,_empty_result); }
  public Meta get_meta( Target t ) { return _metas.get(t); }
  public int get_iterations() { return _iterations; }
  public Status status() { return _status; }
  /** Analysis failures, by callable. */
  public Map<Target,Throwable> get_errors() { return Collections.unmodifiableMap(_errors); }

  /** Drop retained models and results. */
  public void cleanup() {
    _models.clear();
    _results.clear();
    _metas.clear();
  }

  @Override public String toString() { return "FixpointState("+_status+", "+_iterations+" iterations, "+_models.size()+" models)"; }
}
