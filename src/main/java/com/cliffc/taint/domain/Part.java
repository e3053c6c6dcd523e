package com.cliffc.taint.domain;

import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/** A typed key naming a structural slot of values of type {@code D}, whose
 *  contents are of type {@code A}.  Each domain defines a closed set of these
 *  as inner classes; composite domains wrap the parts of their sub-domains.
 *  Parts compare by identity unless a lifting part says otherwise. */
public abstract class Part<D,A> {
  public final String _name;
  protected Part( String name ) { _name = name; }

  // Rewrite every A inside v
  public abstract D map( D v, Function<A,A> f );
  // Drop every A failing the predicate
  public abstract D filter( D v, Predicate<A> p );
  // Join a single A into v
  public abstract D add( D v, A a );
  public abstract <B> B fold( D v, BiFunction<A,B,B> f, B init );
  public abstract <K> Map<K,D> partition( D v, Function<A,K> f );

  // Add, skipping any normalization the owning domain would do (product
  // strictness).  Used by create, which normalizes once at the end.
  public D add_lax( D v, A a ) { return add(v,a); }

  @Override public String toString() { return _name; }
}
