package com.cliffc.taint.domain;

import com.cliffc.taint.util.SB;

import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/** Finite maps from keys to values of a value domain, pointwise ordered.
 *  A key mapped to the value bottom is never stored. */
public class MapDomain<K,V> extends Domain<Map<K,V>> {
  public final Domain<V> _vals;
  public final Part<Map<K,V>,K> KEY;
  public final Part<Map<K,V>,Map.Entry<K,V>> KEY_VALUE;

  public MapDomain( String name, Domain<V> vals ) {
    super(name);
    _vals = vals;
    KEY = new KeyPart();
    KEY_VALUE = new KeyValuePart();
  }

  @Override public Map<K,V> bottom() { return Map.of(); }
  @Override public boolean is_bottom( Map<K,V> m ) { return m.isEmpty(); }

  public V get( Map<K,V> m, K k ) {
    V v = m.get(k);
    return v==null ? _vals.bottom() : v;
  }
  public Map<K,V> set( Map<K,V> m, K k, V v ) {
    if( _vals.is_bottom(v) && !m.containsKey(k) ) return m;
    HashMap<K,V> res = new HashMap<>(m);
    if( _vals.is_bottom(v) ) res.remove(k);
    else res.put(k,v);
    return freeze(res);
  }
  public Map<K,V> singleton( K k, V v ) { return _vals.is_bottom(v) ? bottom() : Map.of(k,v); }
  public Map<K,V> update( Map<K,V> m, K k, Function<V,V> f ) { return set(m,k,f.apply(get(m,k))); }
  private Map<K,V> freeze( Map<K,V> m ) { return m.isEmpty() ? bottom() : Collections.unmodifiableMap(m); }

  @Override public Map<K,V> join( Map<K,V> a, Map<K,V> b ) {
    if( a==b || b.isEmpty() ) return a;
    if( a.isEmpty() ) return b;
    HashMap<K,V> res = new HashMap<>(a);
    for( Map.Entry<K,V> e : b.entrySet() )
      res.merge(e.getKey(),e.getValue(),_vals::join);
    return freeze(res);
  }

  @Override public Map<K,V> widen( int iteration, Map<K,V> prev, Map<K,V> next ) {
    if( prev==next ) return prev;
    HashMap<K,V> res = new HashMap<>(prev);
    for( Map.Entry<K,V> e : next.entrySet() )
      res.put(e.getKey(),_vals.widen(iteration,get(prev,e.getKey()),e.getValue()));
    return freeze(res);
  }

  @Override public boolean less_or_equal( Map<K,V> left, Map<K,V> right ) {
    if( left==right ) return true;
    for( Map.Entry<K,V> e : left.entrySet() )
      if( !_vals.less_or_equal(e.getValue(),get(right,e.getKey())) )
        return false;
    return true;
  }

  @Override public Map<K,V> subtract( Map<K,V> to_remove, Map<K,V> from ) {
    if( to_remove==from ) return bottom();
    if( to_remove.isEmpty() ) return from;
    HashMap<K,V> res = new HashMap<>();
    for( Map.Entry<K,V> e : from.entrySet() ) {
      V v = _vals.subtract(get(to_remove,e.getKey()),e.getValue());
      if( !_vals.is_bottom(v) ) res.put(e.getKey(),v);
    }
    return freeze(res);
  }

  /** Lift a part of the value domain to apply to every value. */
  public <A> Part<Map<K,V>,A> lift( Part<V,A> part ) { return new ValuePart<>(part); }

  @Override public List<Part<Map<K,V>,?>> parts() {
    ArrayList<Part<Map<K,V>,?>> ps = new ArrayList<>(List.of(SELF,KEY,KEY_VALUE));
    for( Part<V,?> p : _vals.parts() ) ps.add(lift(p));
    return ps;
  }
  @Override public List<String> structure() {
    ArrayList<String> ss = new ArrayList<>();
    ss.add(_name+" Map ->");
    for( String s : _vals.structure() ) ss.add("  "+s);
    return ss;
  }
  // Sorted by key print form, for stable output
  @Override public String show( Map<K,V> m ) {
    TreeMap<String,V> sorted = new TreeMap<>();
    for( Map.Entry<K,V> e : m.entrySet() ) sorted.put(e.getKey().toString(),e.getValue());
    SB sb = new SB().p('{');
    boolean first = true;
    for( Map.Entry<String,V> e : sorted.entrySet() ) {
      if( !first ) sb.p(", ");
      first = false;
      sb.p(e.getKey()).p(" -> ").p(_vals.show(e.getValue()));
    }
    return sb.p('}').toString();
  }

  private final class KeyPart extends Part<Map<K,V>,K> {
    KeyPart() { super(MapDomain.this._name+".Key"); }
    // Colliding keys join their values
    @Override public Map<K,V> map( Map<K,V> m, Function<K,K> f ) {
      HashMap<K,V> res = new HashMap<>();
      for( Map.Entry<K,V> e : m.entrySet() )
        res.merge(f.apply(e.getKey()),e.getValue(),_vals::join);
      return freeze(res);
    }
    @Override public Map<K,V> filter( Map<K,V> m, Predicate<K> p ) {
      HashMap<K,V> res = new HashMap<>();
      for( Map.Entry<K,V> e : m.entrySet() )
        if( p.test(e.getKey()) ) res.put(e.getKey(),e.getValue());
      return res.size()==m.size() ? m : freeze(res);
    }
    @Override public Map<K,V> add( Map<K,V> m, K k ) {
      throw new IllegalStateException("Cannot add a key without a value to "+_name);
    }
    @Override public <B> B fold( Map<K,V> m, BiFunction<K,B,B> f, B init ) {
      B acc = init;
      for( K k : m.keySet() ) acc = f.apply(k,acc);
      return acc;
    }
    @Override public <P> Map<P,Map<K,V>> partition( Map<K,V> m, Function<K,P> f ) {
      return KEY_VALUE.partition(m,e -> f.apply(e.getKey()));
    }
  }

  private final class KeyValuePart extends Part<Map<K,V>,Map.Entry<K,V>> {
    KeyValuePart() { super(MapDomain.this._name+".KeyValue"); }
    @Override public Map<K,V> map( Map<K,V> m, Function<Map.Entry<K,V>,Map.Entry<K,V>> f ) {
      HashMap<K,V> res = new HashMap<>();
      for( Map.Entry<K,V> e : m.entrySet() ) {
        Map.Entry<K,V> kv = f.apply(e);
        if( !_vals.is_bottom(kv.getValue()) )
          res.merge(kv.getKey(),kv.getValue(),_vals::join);
      }
      return freeze(res);
    }
    @Override public Map<K,V> filter( Map<K,V> m, Predicate<Map.Entry<K,V>> p ) {
      HashMap<K,V> res = new HashMap<>();
      for( Map.Entry<K,V> e : m.entrySet() )
        if( p.test(e) ) res.put(e.getKey(),e.getValue());
      return res.size()==m.size() ? m : freeze(res);
    }
    @Override public Map<K,V> add( Map<K,V> m, Map.Entry<K,V> kv ) { return update(m,kv.getKey(),v -> _vals.join(v,kv.getValue())); }
    @Override public <B> B fold( Map<K,V> m, BiFunction<Map.Entry<K,V>,B,B> f, B init ) {
      B acc = init;
      for( Map.Entry<K,V> e : m.entrySet() ) acc = f.apply(e,acc);
      return acc;
    }
    @Override public <P> Map<P,Map<K,V>> partition( Map<K,V> m, Function<Map.Entry<K,V>,P> f ) {
      HashMap<P,HashMap<K,V>> groups = new HashMap<>();
      for( Map.Entry<K,V> e : m.entrySet() ) {
        P key = f.apply(e);
        if( key != null ) groups.computeIfAbsent(key,x -> new HashMap<>()).put(e.getKey(),e.getValue());
      }
      HashMap<P,Map<K,V>> res = new HashMap<>();
      for( Map.Entry<P,HashMap<K,V>> g : groups.entrySet() ) res.put(g.getKey(),freeze(g.getValue()));
      return res;
    }
  }

  // A value part, applied to every value
  private final class ValuePart<A> extends Part<Map<K,V>,A> {
    final Part<V,A> _inner;
    ValuePart( Part<V,A> inner ) { super(MapDomain.this._name+"."+inner._name); _inner = inner; }
    @Override public Map<K,V> map( Map<K,V> m, Function<A,A> f ) { return each(m,v -> _inner.map(v,f)); }
    @Override public Map<K,V> filter( Map<K,V> m, Predicate<A> p ) { return each(m,v -> _inner.filter(v,p)); }
    @Override public Map<K,V> add( Map<K,V> m, A a ) { return each(m,v -> _inner.add(v,a)); }
    @Override public <B> B fold( Map<K,V> m, BiFunction<A,B,B> f, B init ) {
      B acc = init;
      for( V v : m.values() ) acc = _inner.fold(v,f,acc);
      return acc;
    }
    @Override public <P> Map<P,Map<K,V>> partition( Map<K,V> m, Function<A,P> f ) {
      HashMap<P,Map<K,V>> res = new HashMap<>();
      for( Map.Entry<K,V> e : m.entrySet() )
        for( Map.Entry<P,V> kv : _inner.partition(e.getValue(),f).entrySet() )
          res.merge(kv.getKey(),singleton(e.getKey(),kv.getValue()),MapDomain.this::join);
      return res;
    }
    // The same map back if no value changed
    private Map<K,V> each( Map<K,V> m, Function<V,V> f ) {
      HashMap<K,V> res = new HashMap<>();
      boolean changed = false;
      for( Map.Entry<K,V> e : m.entrySet() ) {
        V v = f.apply(e.getValue());
        if( v != e.getValue() ) changed = true;
        if( !_vals.is_bottom(v) ) res.put(e.getKey(),v);
      }
      return changed ? freeze(res) : m;
    }
    MapDomain<K,V> owner() { return MapDomain.this; }
    @Override public boolean equals( Object o ) {
      return o instanceof MapDomain<?,?>.ValuePart<?> vp && vp.owner()==owner() && vp._inner.equals(_inner);
    }
    @Override public int hashCode() { return System.identityHashCode(owner())*31+_inner.hashCode(); }
  }
}
