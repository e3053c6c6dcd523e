package com.cliffc.taint.taint;

import com.cliffc.taint.domain.OverUnderSetDomain.OverUnder;

import java.util.Objects;
import java.util.Set;

/** What is known about one flow of one kind: how it got here, the
 *  breadcrumbs picked up on the way, and (for taint-in-taint-out) where in
 *  the return value it ends up.  Immutable; the with_ methods copy. */
public final class FlowDetails {
  public final Set<TraceInfo> _trace;
  public final OverUnder<Feature> _simple;
  public final Set<ReturnAccessPath> _complex;

  public FlowDetails( Set<TraceInfo> trace, OverUnder<Feature> simple, Set<ReturnAccessPath> complex ) {
    _trace = trace; _simple = simple; _complex = complex;
  }
  public FlowDetails with_trace( Set<TraceInfo> trace ) { return trace==_trace ? this : new FlowDetails(trace,_simple,_complex); }
  public FlowDetails with_simple( OverUnder<Feature> simple ) { return simple==_simple ? this : new FlowDetails(_trace,simple,_complex); }
  public FlowDetails with_complex( Set<ReturnAccessPath> complex ) { return complex==_complex ? this : new FlowDetails(_trace,_simple,complex); }

  @Override public boolean equals( Object o ) {
    return o instanceof FlowDetails f && _trace.equals(f._trace) && _simple.equals(f._simple) && _complex.equals(f._complex);
  }
  @Override public int hashCode() { return Objects.hash(_trace,_simple,_complex); }
  @Override public String toString() { return "{trace="+_trace+", simple="+_simple+", complex="+_complex+"}"; }
}
