package com.cliffc.taint.domain;

import com.cliffc.taint.util.SB;

import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/** An abstract domain: a lattice of immutable values of type {@code T}.

    Every domain has a unique bottom which is the identity for join and
    absorbing for subtract.  Values are never mutated; every operation returns
    a (possibly shared) new value.

    Besides the lattice operations, every domain exposes a closed set of
    {@link Part}s describing its internal structure.  Callers traverse,
    rewrite and build values through parts without knowing the concrete
    layout: {@link #transform}, {@link #fold}, {@link #partition} and
    {@link #create}.  Composite domains (tree, map, product) lift the parts
    of their sub-domains, so a traversal can reach a deeply nested element
    through one uniform interface.
 */
public abstract class Domain<T> {
  public final String _name;
  // Every domain has a part standing for the whole value.
  public final Part<T,T> SELF;

  protected Domain( String name ) {
    _name = name;
    SELF = new SelfPart();
  }

  public abstract T bottom();
  public abstract boolean is_bottom( T v );
  public abstract T join( T a, T b );
  // Must return something at least as large as join(prev,next), and reach a
  // fixed point in a bounded number of steps along any non-decreasing chain.
  public abstract T widen( int iteration, T prev, T next );
  public abstract boolean less_or_equal( T left, T right );
  // Remove the effect of to_remove from from; bottom if to_remove subsumes from.
  public abstract T subtract( T to_remove, T from );

  // Lattice equivalence
  public boolean equal( T a, T b ) { return a==b || (less_or_equal(a,b) && less_or_equal(b,a)); }

  /** The parts of this domain, including lifted parts of sub-domains.  Used
   *  to build routing tables and for introspection. */
  public List<Part<T,?>> parts() { return List.of(SELF); }

  // Built on first traversal; subclasses finish their parts after this constructor.
  private volatile Set<Part<T,?>> _registered;
  private <A> Part<T,A> check_part( Part<T,A> part ) {
    Set<Part<T,?>> ps = _registered;
    if( ps==null ) _registered = ps = Set.copyOf(parts());
    if( !ps.contains(part) ) throw new IllegalStateException("No route to part "+part+" in "+_name);
    return part;
  }

  public final <A> T transform( Part<T,A> part, Transform<A> op, T v ) { return op.apply(check_part(part),v); }
  public final <A,B> B fold( Part<T,A> part, BiFunction<A,B,B> f, B init, T v ) { return check_part(part).fold(v,f,init); }
  /** Group the structural contents of v by key; a null key drops that content. */
  public final <A,K> Map<K,T> partition( Part<T,A> part, Function<A,K> f, T v ) { return check_part(part).partition(v,f); }

  /** Build a value from a list of part values, joined together. */
  public T create( List<PartValue<T,?>> parts ) {
    T v = bottom();
    for( PartValue<T,?> pv : parts ) v = pv.add_to(v);
    return v;
  }
  @SafeVarargs
  public final T create( PartValue<T,?>... parts ) { return create(Arrays.asList(parts)); }

  // Introspection.  Not used for control flow.
  public List<String> structure() { return List.of(_name); }
  public String name( Part<?,?> part ) { return part.toString(); }
  public String show( T v ) { return String.valueOf(v); }
  public String dump() {
    SB sb = new SB();
    for( String s : structure() ) sb.p(s).nl();
    return sb.toString();
  }

  @Override public String toString() { return _name; }

  // The whole value as a part.
  private final class SelfPart extends Part<T,T> {
    SelfPart() { super(Domain.this._name+".Self"); }
    @Override public T map( T v, Function<T,T> f ) { return f.apply(v); }
    @Override public T filter( T v, Predicate<T> p ) { return p.test(v) ? v : bottom(); }
    @Override public T add( T v, T a ) { return join(v,a); }
    @Override public <B> B fold( T v, BiFunction<T,B,B> f, B init ) { return f.apply(v,init); }
    @Override public <K> Map<K,T> partition( T v, Function<T,K> f ) {
      HashMap<K,T> res = new HashMap<>();
      if( is_bottom(v) ) return res;
      K key = f.apply(v);
      if( key != null ) res.put(key,v);
      return res;
    }
  }
}
