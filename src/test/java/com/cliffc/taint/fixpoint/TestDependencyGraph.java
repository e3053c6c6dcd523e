package com.cliffc.taint.fixpoint;

import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class TestDependencyGraph {
  private static Target f( String name ) { return Target.function(name); }

  @Test public void testCalleesFirst() {
    DependencyGraph g = DependencyGraph.builder()
      .add_callable(f("main")).add_callable(f("f")).add_callable(f("g"))
      .add_call(f("main"),f("f")).add_call(f("f"),f("g"))
      .build();
    assertEquals(List.of(f("g"),f("f"),f("main")),g.callables_to_analyze());
    assertEquals(List.of(f("f")),g.dependencies(f("g")));
    assertEquals(List.of(f("main")),g.dependencies(f("f")));
    assertTrue(g.dependencies(f("main")).isEmpty());
    assertTrue(g.override_targets().isEmpty());
  }

  @Test public void testCycle() {
    DependencyGraph g = DependencyGraph.builder()
      .add_callable(f("a")).add_callable(f("b"))
      .add_call(f("a"),f("b")).add_call(f("b"),f("a"))
      .build();
    assertEquals(List.of(f("b"),f("a")),g.callables_to_analyze());
    assertEquals(List.of(f("a")),g.dependencies(f("b")));
    assertEquals(List.of(f("b")),g.dependencies(f("a")));
  }

  // Callees without a body get dependencies but are not analyzed
  @Test public void testStubCallee() {
    DependencyGraph g = DependencyGraph.builder()
      .add_callable(f("main"))
      .add_call(f("main"),f("stub"))
      .build();
    assertEquals(List.of(f("main")),g.callables_to_analyze());
    assertEquals(List.of(f("main")),g.dependencies(f("stub")));
  }

  @Test public void testOverrides() {
    Target am = Target.method("A","m"), bm = Target.method("B","m"), cm = Target.method("C","m");
    Target over = Target.override(am);
    DependencyGraph g = DependencyGraph.builder()
      .add_callable(am).add_callable(bm).add_callable(cm).add_callable(f("main"))
      .add_override(am,bm).add_override(am,cm)
      .add_call(f("main"),over)
      .build();
    assertEquals(List.of(am,bm,cm,over,f("main")),g.callables_to_analyze());
    assertEquals(List.of(bm,cm),g.overrides_of(am));
    assertTrue(g.overrides_of(bm).isEmpty());
    assertEquals(List.of(over),g.dependencies(am));
    assertEquals(List.of(over),g.dependencies(cm));
    assertEquals(List.of(f("main")),g.dependencies(over));
    assertEquals(Set.of(over),g.override_targets());
    assertThrows(IllegalArgumentException.class,() -> DependencyGraph.builder().add_callable(over));
  }

  @Test public void testDeepChain() {
    DependencyGraph.Builder b = DependencyGraph.builder();
    int n = 50000;
    for( int i=0; i<n; i++ ) {
      b.add_callable(f("f"+i));
      if( i+1<n ) b.add_call(f("f"+i),f("f"+(i+1)));
    }
    List<Target> order = b.build().callables_to_analyze();
    assertEquals(n,order.size());
    assertEquals(f("f"+(n-1)),order.get(0));
    assertEquals(f("f0"),order.get(n-1));
  }

  @Test public void testTarget() {
    Target am = Target.method("A","m");
    Target over = Target.override(am);
    assertEquals("A.m",am.toString());
    assertEquals("Override{A.m}",over.toString());
    assertTrue(over.is_override());
    assertEquals(am,over.corresponding_method());
    assertSame(am,am.corresponding_method());
    assertNotEquals(am,over);
    assertNotEquals(f("A.m"),am);
    assertThrows(IllegalArgumentException.class,() -> Target.override(f("g")));
    assertTrue(f("a").compareTo(f("b")) < 0);
  }
}
