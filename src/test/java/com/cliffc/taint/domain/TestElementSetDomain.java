package com.cliffc.taint.domain;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class TestElementSetDomain {
  // Strings ordered by prefix, the way access paths are: "abc" <= "ab".
  // Width 2, truncated to 3 characters, collapsing to the empty prefix.
  private final ElementSetDomain<String> P =
    new ElementSetDomain<>("P",(l,r) -> l.startsWith(r),2,"",s -> s.length() > 3 ? s.substring(0,3) : s,LogManager.getLogger(TestElementSetDomain.class));

  private Set<String> set( String... es ) { return P.of(List.of(es)); }

  @Test public void testJoin() {
    assertEquals(set("a","b"),P.join(set("a"),set("b")));
    Set<String> ab = set("a","b");
    assertSame(ab,P.join(ab,set("a")));
    assertSame(ab,P.join(P.bottom(),ab));
    assertTrue(P.is_bottom(P.join(P.bottom(),P.bottom())));
  }

  @Test public void testOrder() {
    assertTrue (P.less_or_equal(set("abc"),set("ab")));
    assertFalse(P.less_or_equal(set("ab"),set("abc")));
    assertTrue (P.less_or_equal(set("abc","abd"),set("ab")));
    assertFalse(P.less_or_equal(set("abc","x"),set("ab")));
    assertTrue (P.less_or_equal(P.bottom(),set("x")));
    // Lattice-equal but not equal
    assertTrue(P.equal(set("ab","abc"),set("ab")));
    assertNotEquals(set("ab","abc"),set("ab"));
  }

  @Test public void testWidenTruncates() {
    assertEquals(set("abc"),P.widen(1,P.bottom(),set("abcdef")));
    Set<String> ab = set("ab");
    assertSame(ab,P.widen(1,ab,set("ab")));
  }

  @Test public void testWidenCollapsesPastWidth() {
    Set<String> w = P.widen(1,set("a"),set("b","c"));
    assertEquals(set(""),w);
    assertTrue(P.less_or_equal(set("a","b","c"),w));
    assertTrue(P.less_or_equal(set("anything"),w));
    // At width: no collapse
    assertEquals(set("a","b"),P.widen(1,set("a"),set("b")));
  }

  @Test public void testSubtract() {
    assertEquals(set("x"),P.subtract(set("ab"),set("abc","x")));
    Set<String> from = set("abc","x");
    assertSame(from,P.subtract(set("y"),from));
    assertSame(from,P.subtract(P.bottom(),from));
    assertTrue(P.is_bottom(P.subtract(set("a"),set("ab","abc"))));
  }

  @Test public void testElementPart() {
    Set<String> v = set("ab","ac","b");
    assertEquals(set("AB","AC","B"),P.transform(P.ELEMENT,Transform.map(String::toUpperCase),v));
    assertEquals(set("ab","ac"),P.transform(P.ELEMENT,Transform.filter(s -> s.startsWith("a")),v));
    assertSame(v,P.transform(P.ELEMENT,Transform.filter(s -> true),v));
    assertEquals(set("ab","ac","b","c"),P.transform(P.ELEMENT,Transform.add("c"),v));
    assertEquals(Integer.valueOf(5),P.fold(P.ELEMENT,(s,n) -> n+s.length(),0,v));

    Map<Character,Set<String>> parts = P.partition(P.ELEMENT,s -> s.charAt(0),v);
    assertEquals(2,parts.size());
    assertEquals(set("ab","ac"),parts.get('a'));
    assertEquals(set("b"),parts.get('b'));
    // A null key drops the element
    assertEquals(1,P.partition(P.ELEMENT,s -> s.equals("b") ? null : "k",v).size());
  }

  @Test public void testCreate() {
    assertEquals(set("a","b"),P.create(PartValue.of(P.ELEMENT,"a"),PartValue.of(P.ELEMENT,"b")));
    assertEquals(set("a","b"),P.create(PartValue.of(P.SELF,set("a")),PartValue.of(P.ELEMENT,"b")));
    assertTrue(P.is_bottom(P.create(List.of())));
  }

  @Test public void testShow() {
    assertEquals("{a, b, c}",P.show(set("c","a","b")));
    assertEquals("{}",P.show(P.bottom()));
    assertEquals(List.of("P (width 2)"),P.structure());
    assertEquals(List.of("S"),new ElementSetDomain<String>("S").structure());
  }
}
