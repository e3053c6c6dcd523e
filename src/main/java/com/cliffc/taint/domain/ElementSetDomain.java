package com.cliffc.taint.domain;

import com.cliffc.taint.util.SB;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.function.*;

/** A join-closed set of structural elements.

    Elements carry their own partial order (e.g. an access path is subsumed
    by any of its prefixes); a set is below another when each of its
    elements is below some element of the other.  Join is union.

    Widening keeps the lattice of finite height: each element is truncated
    (e.g. to a maximum path length), and if the set then holds more than
    {@code max_width} elements the whole set collapses to a single coarse
    element that subsumes everything.  Both approximations are logged at
    debug.
 */
public class ElementSetDomain<E> extends Domain<Set<E>> {
  final BiPredicate<E,E> _le;   // Element order
  final int _max_width;
  final E _coarse;              // Replaces the whole set past max width
  final UnaryOperator<E> _truncate;
  final Logger _log;
  public final Part<Set<E>,E> ELEMENT;

  // Flat set: elements are ordered by equality, and never widened.
  public ElementSetDomain( String name ) {
    this(name, Object::equals, Integer.MAX_VALUE, null, UnaryOperator.identity(), LogManager.getLogger(ElementSetDomain.class));
  }
  public ElementSetDomain( String name, BiPredicate<E,E> le, int max_width, E coarse, UnaryOperator<E> truncate, Logger log ) {
    super(name);
    assert max_width==Integer.MAX_VALUE || coarse!=null;
    _le = le;
    _max_width = max_width;
    _coarse = coarse;
    _truncate = truncate;
    _log = log;
    ELEMENT = new ElementPart();
  }

  @Override public Set<E> bottom() { return Set.of(); }
  @Override public boolean is_bottom( Set<E> v ) { return v.isEmpty(); }

  public Set<E> singleton( E e ) { return Set.of(e); }
  public Set<E> of( Collection<E> es ) { return es.isEmpty() ? bottom() : Collections.unmodifiableSet(new HashSet<>(es)); }

  @Override public Set<E> join( Set<E> a, Set<E> b ) {
    if( a==b || b.isEmpty() ) return a;
    if( a.isEmpty() ) return b;
    if( a.containsAll(b) ) return a;
    if( b.containsAll(a) ) return b;
    HashSet<E> res = new HashSet<>(a);
    res.addAll(b);
    return Collections.unmodifiableSet(res);
  }

  @Override public Set<E> widen( int iteration, Set<E> prev, Set<E> next ) {
    Set<E> joined = join(prev,next);
    HashSet<E> res = new HashSet<>();
    boolean truncated = false;
    for( E e : joined ) {
      E t = _truncate.apply(e);
      if( !t.equals(e) ) truncated = true;
      res.add(t);
    }
    if( truncated )
      _log.debug("{}: truncated elements while widening {}", _name, show(joined));
    if( res.size() > _max_width ) {
      _log.debug("{}: {} elements exceed width {}, collapsing to {}", _name, res.size(), _max_width, _coarse);
      return singleton(_coarse);
    }
    return truncated ? Collections.unmodifiableSet(res) : joined;
  }

  @Override public boolean less_or_equal( Set<E> left, Set<E> right ) {
    if( left==right || left.isEmpty() ) return true;
    for( E l : left )
      if( !covered(l,right) )
        return false;
    return true;
  }
  private boolean covered( E l, Set<E> right ) {
    if( right.contains(l) ) return true;
    for( E r : right )
      if( _le.test(l,r) )
        return true;
    return false;
  }

  @Override public Set<E> subtract( Set<E> to_remove, Set<E> from ) {
    if( to_remove.isEmpty() || from.isEmpty() ) return from;
    if( to_remove==from ) return bottom();
    HashSet<E> res = new HashSet<>();
    for( E e : from )
      if( !covered(e,to_remove) )
        res.add(e);
    return res.size()==from.size() ? from : of(res);
  }

  @Override public List<Part<Set<E>,?>> parts() { return List.of(SELF,ELEMENT); }
  @Override public List<String> structure() {
    return List.of(_name+( _max_width==Integer.MAX_VALUE ? "" : " (width "+_max_width+")"));
  }

  // Sorted by print form, for stable output
  @Override public String show( Set<E> v ) {
    ArrayList<String> ss = new ArrayList<>();
    for( E e : v ) ss.add(e.toString());
    Collections.sort(ss);
    return new SB().p('{').p(ss,", ").p('}').toString();
  }

  private final class ElementPart extends Part<Set<E>,E> {
    ElementPart() { super(ElementSetDomain.this._name+".Element"); }
    @Override public Set<E> map( Set<E> v, Function<E,E> f ) {
      ArrayList<E> res = new ArrayList<>();
      for( E e : v ) res.add(f.apply(e));
      return of(res);
    }
    @Override public Set<E> filter( Set<E> v, Predicate<E> p ) {
      ArrayList<E> res = new ArrayList<>();
      for( E e : v ) if( p.test(e) ) res.add(e);
      return res.size()==v.size() ? v : of(res);
    }
    @Override public Set<E> add( Set<E> v, E e ) { return join(v,singleton(e)); }
    @Override public <B> B fold( Set<E> v, BiFunction<E,B,B> f, B init ) {
      B acc = init;
      for( E e : v ) acc = f.apply(e,acc);
      return acc;
    }
    @Override public <K> Map<K,Set<E>> partition( Set<E> v, Function<E,K> f ) {
      HashMap<K,Set<E>> res = new HashMap<>();
      for( E e : v ) {
        K key = f.apply(e);
        if( key != null ) res.merge(key,singleton(e),ElementSetDomain.this::join);
      }
      return res;
    }
  }
}
