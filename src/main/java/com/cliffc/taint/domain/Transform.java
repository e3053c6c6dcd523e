package com.cliffc.taint.domain;

import java.util.function.Function;
import java.util.function.Predicate;

/** The closed set of rewrites a {@link Part} supports. */
public abstract class Transform<A> {
  abstract <D> D apply( Part<D,A> part, D v );

  public static <A> Transform<A> map   ( Function<A,A> f ) { return new Map<>(f); }
  public static <A> Transform<A> add   ( A a )             { return new Add<>(a); }
  public static <A> Transform<A> filter( Predicate<A> p )  { return new Filter<>(p); }

  public static final class Map<A> extends Transform<A> {
    public final Function<A,A> _f;
    Map( Function<A,A> f ) { _f = f; }
    @Override <D> D apply( Part<D,A> part, D v ) { return part.map(v,_f); }
  }
  public static final class Add<A> extends Transform<A> {
    public final A _a;
    Add( A a ) { _a = a; }
    @Override <D> D apply( Part<D,A> part, D v ) { return part.add(v,_a); }
  }
  public static final class Filter<A> extends Transform<A> {
    public final Predicate<A> _p;
    Filter( Predicate<A> p ) { _p = p; }
    @Override <D> D apply( Part<D,A> part, D v ) { return part.filter(v,_p); }
  }
}
