package com.cliffc.taint.domain;

import com.cliffc.taint.util.SB;

import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/** Cheap, unordered facts kept as a pair of sets: an over-approximation (the
 *  fact holds on some path) and an under-approximation (the fact holds on
 *  every path).  Join unions the over sets and intersects the under sets.
 *  Bottom is distinct from the empty set of facts: joining with bottom keeps
 *  the under set, joining with an empty fact set clears it. */
public class OverUnderSetDomain<E> extends Domain<OverUnderSetDomain.OverUnder<E>> {

  public static final class OverUnder<E> {
    public final Set<E> _over;
    public final Set<E> _under;   // Always a subset of _over
    final boolean _bot;
    OverUnder( Set<E> over, Set<E> under, boolean bot ) {
      assert over.containsAll(under);
      _over = over; _under = under; _bot = bot;
    }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      if( !(o instanceof OverUnder<?> ou) ) return false;
      return _bot==ou._bot && _over.equals(ou._over) && _under.equals(ou._under);
    }
    @Override public int hashCode() { return Objects.hash(_over,_under,_bot); }
    @Override public String toString() {
      if( _bot ) return "_|_";
      return new SB().p("[over: ").p(sorted(_over),", ").p("; under: ").p(sorted(_under),", ").p(']').toString();
    }
    private static <E> List<String> sorted( Set<E> es ) {
      ArrayList<String> ss = new ArrayList<>();
      for( E e : es ) ss.add(e.toString());
      Collections.sort(ss);
      return ss;
    }
  }

  /** An element with a flag telling whether it is in the under set. */
  public static final class ElementAndUnder<E> {
    public final E _element;
    public final boolean _in_under;
    public ElementAndUnder( E element, boolean in_under ) { _element = element; _in_under = in_under; }
    @Override public boolean equals( Object o ) {
      return o instanceof ElementAndUnder<?> eu && _in_under==eu._in_under && _element.equals(eu._element);
    }
    @Override public int hashCode() { return _element.hashCode()*2+(_in_under?1:0); }
    @Override public String toString() { return _element+(_in_under ? "(always)" : ""); }
  }

  private final OverUnder<E> _bottom = new OverUnder<>(Set.of(),Set.of(),true);
  private final OverUnder<E> _empty  = new OverUnder<>(Set.of(),Set.of(),false);
  public final Part<OverUnder<E>,E> ELEMENT;
  public final Part<OverUnder<E>,ElementAndUnder<E>> ELEMENT_AND_UNDER;

  public OverUnderSetDomain( String name ) {
    super(name);
    ELEMENT = new ElementPart();
    ELEMENT_AND_UNDER = new ElementAndUnderPart();
  }

  @Override public OverUnder<E> bottom() { return _bottom; }
  @Override public boolean is_bottom( OverUnder<E> v ) { return v._bot; }
  // No facts, on every path
  public OverUnder<E> empty() { return _empty; }
  // Facts holding on every path
  @SafeVarargs
  public final OverUnder<E> of( E... es ) {
    Set<E> s = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(es)));
    return new OverUnder<>(s,s,false);
  }
  public OverUnder<E> make( Set<E> over, Set<E> under ) {
    return new OverUnder<>(Collections.unmodifiableSet(new HashSet<>(over)),Collections.unmodifiableSet(new HashSet<>(under)),false);
  }

  @Override public OverUnder<E> join( OverUnder<E> a, OverUnder<E> b ) {
    if( a==b || b._bot ) return a;
    if( a._bot ) return b;
    HashSet<E> over = new HashSet<>(a._over);
    over.addAll(b._over);
    HashSet<E> under = new HashSet<>(a._under);
    under.retainAll(b._under);
    OverUnder<E> res = make(over,under);
    return res.equals(a) ? a : res;
  }
  // Finite set of facts; join already terminates.
  @Override public OverUnder<E> widen( int iteration, OverUnder<E> prev, OverUnder<E> next ) { return join(prev,next); }

  @Override public boolean less_or_equal( OverUnder<E> left, OverUnder<E> right ) {
    if( left==right || left._bot ) return true;
    if( right._bot ) return false;
    return right._over.containsAll(left._over) && left._under.containsAll(right._under);
  }

  @Override public OverUnder<E> subtract( OverUnder<E> to_remove, OverUnder<E> from ) {
    if( from._bot ) return from;
    return less_or_equal(from,to_remove) ? _bottom : from;
  }

  @Override public List<Part<OverUnder<E>,?>> parts() { return List.of(SELF,ELEMENT,ELEMENT_AND_UNDER); }
  @Override public List<String> structure() { return List.of(_name+" (over/under)"); }

  // Elements appear in both sets at once; a rewrite keeps each element's under membership.
  private OverUnder<E> rebuild( OverUnder<E> v, List<ElementAndUnder<E>> es ) {
    HashSet<E> over = new HashSet<>(), under = new HashSet<>();
    for( ElementAndUnder<E> eu : es ) {
      over.add(eu._element);
      if( eu._in_under ) under.add(eu._element);
    }
    OverUnder<E> res = make(over,under);
    return res.equals(v) ? v : res;
  }
  private List<ElementAndUnder<E>> elements( OverUnder<E> v ) {
    ArrayList<ElementAndUnder<E>> es = new ArrayList<>();
    for( E e : v._over ) es.add(new ElementAndUnder<>(e,v._under.contains(e)));
    return es;
  }

  private final class ElementPart extends Part<OverUnder<E>,E> {
    ElementPart() { super(OverUnderSetDomain.this._name+".Element"); }
    @Override public OverUnder<E> map( OverUnder<E> v, Function<E,E> f ) {
      if( v._bot ) return v;
      ArrayList<ElementAndUnder<E>> es = new ArrayList<>();
      for( ElementAndUnder<E> eu : elements(v) ) es.add(new ElementAndUnder<>(f.apply(eu._element),eu._in_under));
      return rebuild(v,es);
    }
    @Override public OverUnder<E> filter( OverUnder<E> v, Predicate<E> p ) {
      if( v._bot ) return v;
      ArrayList<ElementAndUnder<E>> es = new ArrayList<>();
      for( ElementAndUnder<E> eu : elements(v) ) if( p.test(eu._element) ) es.add(eu);
      return rebuild(v,es);
    }
    // Adding a fact adds it on every path
    @Override public OverUnder<E> add( OverUnder<E> v, E e ) { return ELEMENT_AND_UNDER.add(v,new ElementAndUnder<>(e,true)); }
    @Override public <B> B fold( OverUnder<E> v, BiFunction<E,B,B> f, B init ) {
      B acc = init;
      for( E e : v._over ) acc = f.apply(e,acc);
      return acc;
    }
    @Override public <K> Map<K,OverUnder<E>> partition( OverUnder<E> v, Function<E,K> f ) {
      return ELEMENT_AND_UNDER.partition(v,eu -> f.apply(eu._element));
    }
  }

  private final class ElementAndUnderPart extends Part<OverUnder<E>,ElementAndUnder<E>> {
    ElementAndUnderPart() { super(OverUnderSetDomain.this._name+".ElementAndUnder"); }
    @Override public OverUnder<E> map( OverUnder<E> v, Function<ElementAndUnder<E>,ElementAndUnder<E>> f ) {
      if( v._bot ) return v;
      ArrayList<ElementAndUnder<E>> es = new ArrayList<>();
      for( ElementAndUnder<E> eu : elements(v) ) es.add(f.apply(eu));
      return rebuild(v,es);
    }
    @Override public OverUnder<E> filter( OverUnder<E> v, Predicate<ElementAndUnder<E>> p ) {
      if( v._bot ) return v;
      ArrayList<ElementAndUnder<E>> es = new ArrayList<>();
      for( ElementAndUnder<E> eu : elements(v) ) if( p.test(eu) ) es.add(eu);
      return rebuild(v,es);
    }
    @Override public OverUnder<E> add( OverUnder<E> v, ElementAndUnder<E> a ) {
      List<ElementAndUnder<E>> es = elements(v);
      es.removeIf(eu -> eu._element.equals(a._element));
      es.add(a);
      return rebuild(v,es);
    }
    @Override public <B> B fold( OverUnder<E> v, BiFunction<ElementAndUnder<E>,B,B> f, B init ) {
      B acc = init;
      for( ElementAndUnder<E> eu : elements(v) ) acc = f.apply(eu,acc);
      return acc;
    }
    @Override public <K> Map<K,OverUnder<E>> partition( OverUnder<E> v, Function<ElementAndUnder<E>,K> f ) {
      HashMap<K,List<ElementAndUnder<E>>> groups = new HashMap<>();
      for( ElementAndUnder<E> eu : elements(v) ) {
        K key = f.apply(eu);
        if( key != null ) groups.computeIfAbsent(key,k -> new ArrayList<>()).add(eu);
      }
      HashMap<K,OverUnder<E>> res = new HashMap<>();
      for( Map.Entry<K,List<ElementAndUnder<E>>> e : groups.entrySet() )
        res.put(e.getKey(),rebuild(_empty,e.getValue()));
      return res;
    }
  }
}
