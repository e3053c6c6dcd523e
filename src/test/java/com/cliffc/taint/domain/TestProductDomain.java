package com.cliffc.taint.domain;

import com.cliffc.taint.domain.ProductDomain.Slot;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class TestProductDomain {
  // A two-field product; 'a' is strict
  static final class Pair {
    final Set<String> _a, _b;
    Pair( Set<String> a, Set<String> b ) { _a = a; _b = b; }
    @Override public boolean equals( Object o ) { return o instanceof Pair p && _a.equals(p._a) && _b.equals(p._b); }
    @Override public int hashCode() { return _a.hashCode()*31+_b.hashCode(); }
    @Override public String toString() { return "("+_a+","+_b+")"; }
  }
  private static final Pair BOT = new Pair(Set.of(),Set.of());

  private final ElementSetDomain<String> SA = new ElementSetDomain<>("SA");
  private final ElementSetDomain<String> SB = new ElementSetDomain<>("SB");
  private final Slot<Pair,Set<String>> A = Slot.strict("a",SA,p -> p._a,(p,v) -> new Pair(v,p._b));
  private final Slot<Pair,Set<String>> B = Slot.of    ("b",SB,p -> p._b,(p,v) -> new Pair(p._a,v));
  private final ProductDomain<Pair> D = new ProductDomain<>("P",BOT,A,B);

  private static Set<String> set( String... es ) { return Set.of(es); }
  private static Pair pair( Set<String> a, Set<String> b ) { return new Pair(a,b); }

  @Test public void testStrictSlot() {
    assertTrue(D.is_bottom(pair(set(),set("y"))));
    assertFalse(D.is_bottom(pair(set("x"),set())));
    // Filling a non-strict slot of bottom stays bottom
    assertSame(BOT,D.update(B,set("y"),BOT));
    Pair p = pair(set("x"),set("y"));
    assertSame(BOT,D.update(A,set(),p));
    assertEquals(pair(set("x"),set()),D.update(B,set(),p));
    assertEquals(pair(set("z"),set("y")),D.update(A,set("z"),p));
    assertEquals(set("y"),D.get(B,p));
  }

  @Test public void testLattice() {
    Pair x = pair(set("x"),set());
    Pair y = pair(set("y"),set("z"));
    Pair j = D.join(x,y);
    assertEquals(pair(set("x","y"),set("z")),j);
    assertTrue (D.less_or_equal(x,j));
    assertFalse(D.less_or_equal(j,x));
    assertTrue (D.less_or_equal(pair(set(),set("q")),x)); // bottom by strictness
    assertSame(x,D.join(x,BOT));
    assertEquals(j,D.widen(1,x,y));
  }

  // Subtracting a strict slot away keeps the whole value, unless it is subsumed
  @Test public void testSubtract() {
    Pair from = pair(set("x"),set("z"));
    assertEquals(from,D.subtract(pair(set("x"),set()),from));
    assertEquals(pair(set("y"),set("z")),D.subtract(pair(set("x"),set()),pair(set("x","y"),set("z"))));
    assertSame(BOT,D.subtract(pair(set("x"),set("z","w")),from));
    assertSame(from,D.subtract(BOT,from));
  }

  @Test public void testRoutes() {
    assertEquals(0,D.route(SA.ELEMENT));
    assertEquals(1,D.route(SB.SELF));
    ElementSetDomain<String> other = new ElementSetDomain<>("Other");
    IllegalStateException e = assertThrows(IllegalStateException.class,() -> D.route(other.ELEMENT));
    assertTrue(e.getMessage().startsWith("No route to part"));
    // A part owned by the other slot
    assertThrows(IllegalStateException.class,() -> D.lift(A,SB.ELEMENT));
  }

  @Test public void testUnregisteredSlot() {
    Slot<Pair,Set<String>> C = Slot.of("c",SB,p -> p._b,(p,v) -> new Pair(p._a,v));
    assertThrows(IndexOutOfBoundsException.class,() -> D.update(C,set("y"),pair(set("x"),set())));
    assertThrows(IndexOutOfBoundsException.class,() -> D.lift(C,SB.ELEMENT));
  }

  @Test public void testBadConstruction() {
    // Slots are bound to one position
    assertThrows(IllegalStateException.class,() -> new ProductDomain<>("Q",BOT,B,A));
    // One sub-domain reachable through two slots
    ElementSetDomain<String> s = new ElementSetDomain<>("S");
    Slot<Pair,Set<String>> a = Slot.of("a",s,p -> p._a,(p,v) -> new Pair(v,p._b));
    Slot<Pair,Set<String>> b = Slot.of("b",s,p -> p._b,(p,v) -> new Pair(p._a,v));
    assertThrows(IllegalStateException.class,() -> new ProductDomain<>("R",BOT,a,b));
  }

  @Test public void testCreate() {
    Part<Pair,String> ea = D.lift(A,SA.ELEMENT), eb = D.lift(B,SB.ELEMENT);
    // Strictness is checked once all parts are in, so order does not matter
    assertEquals(pair(set("x"),set("z")),D.create(PartValue.of(eb,"z"),PartValue.of(ea,"x")));
    assertSame(BOT,D.create(PartValue.of(eb,"z")));
  }

  @Test public void testLiftedParts() {
    Part<Pair,String> ea = D.lift(A,SA.ELEMENT), eb = D.lift(B,SB.ELEMENT);
    Pair p = pair(set("x","y"),set("z"));
    assertEquals(pair(set("x","y"),set("z","w")),D.transform(eb,Transform.add("w"),p));
    assertEquals(pair(set("X","Y"),set("z")),D.transform(ea,Transform.map(String::toUpperCase),p));
    assertSame(BOT,D.transform(ea,Transform.filter(s -> false),p));
    assertEquals(pair(set("x","y"),set()),D.transform(eb,Transform.filter(s -> false),p));
    assertEquals("z",D.fold(eb,(s,acc) -> acc+s,"",p));

    Map<String,Pair> parts = D.partition(ea,s -> s,p);
    assertEquals(2,parts.size());
    assertEquals(pair(set("x"),set("z")),parts.get("x"));
    assertEquals(pair(set("y"),set("z")),parts.get("y"));
    // Groups made bottom by strictness are dropped
    assertTrue(D.partition(eb,s -> s,pair(set(),set("z"))).isEmpty());

    assertTrue(D.parts().contains(ea));
    assertEquals(ea,D.lift(A,SA.ELEMENT));
    assertNotEquals(ea,eb);
  }

  @Test public void testShow() {
    assertEquals(List.of("P Product [","  a (strict)","    SA","  b","    SB","]"),D.structure());
    assertEquals("{a: {x}, b: {y, z}}",D.show(pair(set("x"),set("z","y"))));
    assertEquals("_|_",D.show(BOT));
    assertEquals("P(a,b).Self",D.name(D.SELF));
  }
}
