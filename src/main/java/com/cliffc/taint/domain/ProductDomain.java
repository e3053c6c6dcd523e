package com.cliffc.taint.domain;

import com.cliffc.taint.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/** A heterogeneous tuple of sub-domains, addressed by typed {@link Slot}s.

    Product values are plain immutable Java objects of type {@code P}; each
    slot is a lens (getter plus copying setter) onto one field of that object
    together with the field's domain.  All lattice operations are slot-wise.

    A strict slot makes the whole product bottom as soon as that slot is
    bottom: {@link #update} re-checks every strict slot.

    At construction a routing table maps every part exposed by every slot's
    domain (transitively) to the owning slot.  {@link #lift} turns a slot's
    sub-part into a part of the product; lifting a part the slot does not
    own is a programming error.
 */
public class ProductDomain<P> extends Domain<P> {

  /** One field of a product: name, domain, strictness and a lens onto P. */
  public static final class Slot<P,V> {
    public final String _name;
    public final Domain<V> _domain;
    public final boolean _strict;
    final Function<P,V> _get;
    final BiFunction<P,V,P> _set;
    int _idx = -1;              // Position in the owning product
    private Slot( String name, Domain<V> domain, boolean strict, Function<P,V> get, BiFunction<P,V,P> set ) {
      _name = name; _domain = domain; _strict = strict; _get = get; _set = set;
    }
    public static <P,V> Slot<P,V> of( String name, Domain<V> domain, Function<P,V> get, BiFunction<P,V,P> set ) {
      return new Slot<>(name,domain,false,get,set);
    }
    public static <P,V> Slot<P,V> strict( String name, Domain<V> domain, Function<P,V> get, BiFunction<P,V,P> set ) {
      return new Slot<>(name,domain,true,get,set);
    }
    public V get( P p ) { return _get.apply(p); }
    boolean is_bottom( P p ) { return _domain.is_bottom(get(p)); }
    P join( P acc, P a, P b ) { return _set.apply(acc,_domain.join(get(a),get(b))); }
    P widen( int iteration, P acc, P prev, P next ) { return _set.apply(acc,_domain.widen(iteration,get(prev),get(next))); }
    boolean less_or_equal( P l, P r ) { return _domain.less_or_equal(get(l),get(r)); }
    P subtract( P acc, P to_remove, P from ) { return _set.apply(acc,_domain.subtract(get(to_remove),get(from))); }
    String show( P p ) { return _name+": "+_domain.show(get(p)); }
    String slot_name() { return _strict ? _name+" (strict)" : _name; }
    @Override public String toString() { return _name; }
  }

  private final List<Slot<P,?>> _slots;
  private final List<Slot<P,?>> _strict_slots;
  private final P _bottom;
  private final HashMap<Part<?,?>,Integer> _routes = new HashMap<>();

  @SafeVarargs
  public ProductDomain( String name, P bottom, Slot<P,?>... slots ) {
    super(name);
    _slots = List.of(slots);
    _bottom = bottom;
    ArrayList<Slot<P,?>> stricts = new ArrayList<>();
    for( int i=0; i<slots.length; i++ ) {
      Slot<P,?> slot = slots[i];
      if( slot._idx != -1 && slot._idx != i )
        throw new IllegalStateException("Slot "+slot+" already belongs to another product");
      slot._idx = i;
      if( slot._strict ) stricts.add(slot);
      assert slot.is_bottom(bottom) : "Product bottom must be bottom in slot "+slot;
      for( Part<?,?> part : slot._domain.parts() ) {
        Integer old = _routes.put(part,i);
        if( old != null && old != i )
          throw new IllegalStateException("Part "+part+" is reachable through slots "+_slots.get(old)+" and "+slot);
      }
    }
    _strict_slots = List.copyOf(stricts);
  }

  /** The slot owning a sub-part; fatal if no slot owns it. */
  public int route( Part<?,?> part ) {
    Integer i = _routes.get(part);
    if( i==null ) throw new IllegalStateException("No route to part "+part+" in "+_name);
    return i;
  }
  public Slot<P,?> slot( int i ) { return _slots.get(i); }
  public List<Slot<P,?>> slots() { return _slots; }

  // ----------------------------------------------------------
  @Override public P bottom() { return _bottom; }
  @Override public boolean is_bottom( P p ) {
    if( p==_bottom ) return true;
    for( Slot<P,?> s : _strict_slots )
      if( s.is_bottom(p) )
        return true;
    for( Slot<P,?> s : _slots )
      if( !s.is_bottom(p) )
        return false;
    return true;
  }

  private P make_strict( P p ) {
    for( Slot<P,?> s : _strict_slots )
      if( s.is_bottom(p) )
        return _bottom;
    return p;
  }

  public <V> V get( Slot<P,V> slot, P p ) { check(slot); return slot.get(p); }

  /** Replace one slot, collapsing to bottom if any strict slot is bottom. */
  public <V> P update( Slot<P,V> slot, V v, P p ) {
    check(slot);
    if( slot.get(p)==v ) return p;
    if( slot._strict && slot._domain.is_bottom(v) ) return _bottom;
    return make_strict(slot._set.apply(p,v));
  }
  private void check( Slot<P,?> slot ) {
    if( slot._idx < 0 || slot._idx >= _slots.size() || _slots.get(slot._idx)!=slot )
      throw new IndexOutOfBoundsException("Slot "+slot+" is not part of "+_name);
  }

  @Override public P join( P a, P b ) {
    if( a==b ) return a;
    if( is_bottom(a) ) return b;
    if( is_bottom(b) ) return a;
    P acc = _bottom;
    for( Slot<P,?> s : _slots ) acc = s.join(acc,a,b);
    return acc;
  }

  @Override public P widen( int iteration, P prev, P next ) {
    if( prev==next ) return prev;
    if( is_bottom(prev) ) return next;
    if( is_bottom(next) ) return prev;
    P acc = _bottom;
    for( Slot<P,?> s : _slots ) acc = s.widen(iteration,acc,prev,next);
    return acc;
  }

  @Override public boolean less_or_equal( P l, P r ) {
    if( l==r || is_bottom(l) ) return true;
    if( is_bottom(r) ) return false;
    for( Slot<P,?> s : _slots )
      if( !s.less_or_equal(l,r) )
        return false;
    return true;
  }

  // A strict slot subtracted down to bottom does not make the result bottom
  // unless the whole value is subsumed; the value is kept instead.
  @Override public P subtract( P to_remove, P from ) {
    if( to_remove==from ) return _bottom;
    if( is_bottom(to_remove) || is_bottom(from) ) return from;
    if( less_or_equal(from,to_remove) ) return _bottom;
    P acc = _bottom;
    for( Slot<P,?> s : _slots ) acc = s.subtract(acc,to_remove,from);
    return is_bottom(acc) ? from : acc;
  }

  // Slots are filled first, strictness is checked once at the end.
  @Override public P create( List<PartValue<P,?>> parts ) {
    P acc = _bottom;
    for( PartValue<P,?> pv : parts ) acc = pv.add_to(acc);
    return make_strict(acc);
  }

  // ----------------------------------------------------------
  /** Lift a part of one slot's domain to a part of the product. */
  public <V,A> @NotNull Part<P,A> lift( Slot<P,V> slot, Part<V,A> part ) {
    check(slot);
    if( route(part) != slot._idx )
      throw new IllegalStateException("No route to part "+part+" through slot "+slot);
    return new SlotPart<>(slot,part);
  }

  @Override public List<Part<P,?>> parts() {
    ArrayList<Part<P,?>> ps = new ArrayList<>();
    ps.add(SELF);
    for( Slot<P,?> s : _slots ) add_parts(ps,s);
    return ps;
  }
  private <V> void add_parts( List<Part<P,?>> ps, Slot<P,V> s ) {
    for( Part<V,?> p : s._domain.parts() ) ps.add(new SlotPart<>(s,p));
  }

  @Override public List<String> structure() {
    ArrayList<String> ss = new ArrayList<>();
    ss.add(_name+" Product [");
    for( Slot<P,?> s : _slots ) {
      ss.add("  "+s.slot_name());
      for( String x : s._domain.structure() ) ss.add("    "+x);
    }
    ss.add("]");
    return ss;
  }
  @Override public String name( Part<?,?> part ) {
    if( part==SELF ) return _name+"("+new SB().p(_slots,",")+").Self";
    return slot(route(part))._domain.name(part);
  }
  @Override public String show( P p ) {
    if( is_bottom(p) ) return "_|_";
    SB sb = new SB().p('{');
    for( int i=0; i<_slots.size(); i++ ) {
      if( i>0 ) sb.p(", ");
      sb.p(_slots.get(i).show(p));
    }
    return sb.p('}').toString();
  }

  // A slot's sub-part, lifted to the whole product
  private final class SlotPart<V,A> extends Part<P,A> {
    final Slot<P,V> _slot;
    final Part<V,A> _inner;
    SlotPart( Slot<P,V> slot, Part<V,A> inner ) { super(ProductDomain.this._name+"."+slot._name+"."+inner._name); _slot = slot; _inner = inner; }
    @Override public P map( P p, Function<A,A> f ) { return update(_slot,_inner.map(_slot.get(p),f),p); }
    @Override public P filter( P p, Predicate<A> pred ) { return update(_slot,_inner.filter(_slot.get(p),pred),p); }
    @Override public P add( P p, A a ) { return update(_slot,_inner.add(_slot.get(p),a),p); }
    @Override public P add_lax( P p, A a ) { return _slot._set.apply(p,_inner.add_lax(_slot.get(p),a)); }
    @Override public <B> B fold( P p, BiFunction<A,B,B> f, B init ) { return _inner.fold(_slot.get(p),f,init); }
    @Override public <K> Map<K,P> partition( P p, Function<A,K> f ) {
      HashMap<K,P> res = new HashMap<>();
      for( Map.Entry<K,V> e : _inner.partition(_slot.get(p),f).entrySet() ) {
        P q = update(_slot,e.getValue(),p);
        if( !is_bottom(q) ) res.put(e.getKey(),q);
      }
      return res;
    }
    ProductDomain<P> owner() { return ProductDomain.this; }
    @Override public boolean equals( Object o ) {
      return o instanceof ProductDomain<?>.SlotPart<?,?> sp && sp.owner()==owner() && sp._slot==_slot && sp._inner.equals(_inner);
    }
    @Override public int hashCode() { return System.identityHashCode(owner())*31+_inner.hashCode(); }
  }
}
