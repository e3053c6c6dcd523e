package com.cliffc.taint.fixpoint;

import com.cliffc.taint.domain.Domain;

import java.util.function.Function;

/** An interprocedural analysis driven by {@link Fixpoint}.
 *  @param <M> per-callable model, a lattice value
 *  @param <R> per-callable result, e.g. the issues found; replaced on every re-analysis */
public interface Analysis<M,R> {
  /** The lattice of models: join, widen and less_or_equal drive convergence. */
  Domain<M> model_domain();
  R empty_result();
  /** Analyze one callable, reading callee models through callee_models. */
  Analyzed<M,R> analyze( Target callable, M previous, Function<Target,M> callee_models );
  /** Widening used between iterations; the model domain's by default. */
  default M widen( int iteration, M previous, M next ) { return model_domain().widen(iteration,previous,next); }

  /** The outcome of analyzing one callable. */
  final class Analyzed<M,R> {
    public final M _model;
    public final R _result;
    public Analyzed( M model, R result ) { _model = model; _result = result; }
  }
}
