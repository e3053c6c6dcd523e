package com.cliffc.taint.domain;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class TestTreeDomain {
  private final ElementSetDomain<String> S = new ElementSetDomain<>("S");
  private final TreeDomain<Set<String>> T = new TreeDomain<>("T",S);

  private Set<String> set( String... es ) { return S.of(List.of(es)); }
  private Tree<Set<String>> leaf( String... es ) { return T.create_leaf(set(es)); }
  private Tree<Set<String>> at( List<Label> path, String... es ) { return T.prepend(path,leaf(es)); }
  private static List<Label> p( String... fs ) { return Label.path(fs); }

  @Test public void testBottom() {
    assertTrue(T.is_bottom(T.bottom()));
    assertTrue(T.is_bottom(leaf()));
    assertTrue(T.is_bottom(at(p("a","b"))));
    assertEquals("{}",T.show(T.bottom()));
  }

  // read(path, assign(path, t, sub)) is sub joined with what is inherited from above
  @Test public void testReadAfterAssign() {
    Tree<Set<String>> t = T.assign(leaf("root"),p("a","b"),leaf("x"));
    assertEquals(leaf("root","x"),T.read(p("a","b"),t));
    // Nothing stored at [c]: only the inherited root
    assertEquals(leaf("root"),T.read(p("c"),t));
    // Reading above the assignment sees the subtree
    Tree<Set<String>> a = T.read(p("a"),t);
    assertEquals(set("root"),a._element);
    assertEquals(leaf("x"),a.child(Label.field("b")));
    assertTrue(T.is_minimal(t));
  }

  @Test public void testStrongAssignReplaces() {
    Tree<Set<String>> t = at(p("a"),"x");
    assertEquals(at(p("a"),"y"),T.assign(t,p("a"),leaf("y")));
    assertEquals(at(p("a"),"x","y"),T.assign(t,p("a"),leaf("y"),true));
  }

  @Test public void testReadFallsBackToStar() {
    Tree<Set<String>> t = T.join(at(Label.path(Label.ANY),"s"),at(p("a"),"x"));
    assertEquals(leaf("s","x"),T.read(p("a"),t));
    assertEquals(leaf("s"),T.read(p("b"),t));
    assertEquals(leaf("s"),T.read(Label.path(Label.ANY),T.prepend(Label.path(Label.ANY),leaf("s"))));
  }

  @Test public void testReadAnySkipsKeys() {
    Tree<Set<String>> t = T.join(at(Label.path(Label.KEYS),"k"),at(p("a"),"x"));
    assertEquals(leaf("x"),T.read(Label.path(Label.ANY),t));
    assertEquals(leaf("k"),T.read(Label.path(Label.KEYS),t));
  }

  @Test public void testAssignAnyUpdatesEveryField() {
    Tree<Set<String>> t = T.assign(at(p("a"),"x"),Label.path(Label.ANY),leaf("y"));
    assertEquals(leaf("x","y"),T.read(p("a"),t));
    assertEquals(leaf("y"),T.read(p("b"),t));
  }

  // A field on one side only is joined with the other side's [*]
  @Test public void testJoinStarSemantics() {
    Tree<Set<String>> t = T.join(at(Label.path(Label.ANY),"s"),at(p("a"),"x"));
    assertEquals(set("s","x"),t.child(Label.field("a"))._element);
    assertEquals(set("s"),t.child(Label.ANY)._element);
    assertTrue(T.is_minimal(t));
  }

  @Test public void testJoinPrunesCoveredElements() {
    Tree<Set<String>> t = T.join(leaf("x"),at(p("a"),"x"));
    assertEquals(leaf("x"),t);
    assertTrue(t.is_leaf());
  }

  // Removing a covering tree leaves nothing; anything else is kept whole
  @Test public void testSubtract() {
    Tree<Set<String>> xy = leaf("x","y");
    assertTrue(T.is_bottom(T.subtract(xy,leaf("x"))));
    assertTrue(T.is_bottom(T.subtract(leaf("x"),at(p("a","b"),"x"))));
    assertEquals(xy,T.subtract(leaf("x"),xy));
    assertEquals(at(p("a"),"x"),T.subtract(at(p("b"),"x"),at(p("a"),"x")));
    assertTrue(T.is_bottom(T.subtract(xy,xy)));
  }

  // Traversal only accepts this domain's own parts
  @Test public void testForeignPart() {
    TreeDomain<Set<String>> other = new TreeDomain<>("Other",S);
    assertFalse(T.parts().contains(other.PATH));
    assertThrows(IllegalStateException.class,() -> T.transform(other.PATH,Transform.filter(pv -> true),leaf("x")));
    assertThrows(IllegalStateException.class,() -> T.fold(other.lift(S.ELEMENT),(e,n) -> n+1,0,leaf("x")));
    assertThrows(IllegalStateException.class,() -> T.partition(other.RAW_PATH,rp -> rp._path,leaf("x")));
    // A lifted part rebuilt later is still this domain's
    assertEquals(Integer.valueOf(1),T.fold(T.lift(S.ELEMENT),(e,n) -> n+1,0,leaf("x")));
  }

  @Test public void testLessOrEqual() {
    Tree<Set<String>> deep = at(p("a","b"),"x");
    assertTrue (T.less_or_equal(deep,at(p("a"),"x")));  // An ancestor covers its subtree
    assertFalse(T.less_or_equal(at(p("a"),"x"),deep));
    assertTrue (T.less_or_equal(deep,leaf("x")));
    assertFalse(T.less_or_equal(at(p("a"),"x"),at(p("b"),"x")));
    assertTrue (T.less_or_equal(T.bottom(),deep));
  }

  @Test public void testDepths() {
    Tree<Set<String>> t = T.join(at(p("a"),"x"),at(p("b","c"),"y"));
    assertEquals(2,T.max_depth(t));
    assertEquals(1,T.min_depth(t));
    assertEquals(0,T.min_depth(leaf("r")));
  }

  // collapse is the join of every element in the tree
  @Test public void testCollapse() {
    Tree<Set<String>> t = T.join(leaf("r"),T.join(at(p("a"),"x"),at(p("b","c"),"y")));
    assertEquals(set("r","x","y"),T.collapse(t));
    assertEquals(S.bottom(),T.collapse(T.bottom()));
  }

  @Test public void testCollapseTo() {
    Tree<Set<String>> t = T.join(at(p("a"),"x"),at(p("a","b","c"),"y"));
    Tree<Set<String>> c = T.collapse_to(1,t);
    assertEquals(1,T.max_depth(c));
    assertEquals(T.collapse(t),T.collapse(c));
    assertTrue(T.less_or_equal(t,c));
    assertEquals(leaf("x","y"),T.read(p("a"),c));
  }

  @Test public void testCutTreeAfterIsIdempotent() {
    Tree<Set<String>> t = T.join(at(p("a"),"y"),at(p("a","b","c"),"x"));
    Tree<Set<String>> cut = T.cut_tree_after(1,t);
    assertEquals(at(p("a"),"y"),cut);
    assertEquals(cut,T.cut_tree_after(1,cut));
    Tree<Set<String>> cut2 = T.cut_tree_after(2,t);
    assertEquals(cut2,T.cut_tree_after(2,cut2));
  }

  @Test public void testWidenBoundsDepth() {
    TreeDomain<Set<String>> T2 = new TreeDomain<>("T2",S,2,LogManager.getLogger(TestTreeDomain.class));
    Tree<Set<String>> deep = T2.prepend(p("a","b","c","d"),T2.create_leaf(set("x")));
    Tree<Set<String>> w = T2.widen(1,T2.bottom(),deep);
    assertTrue(T2.max_depth(w) <= 2);
    assertTrue(T2.less_or_equal(deep,w));
    assertTrue(T2.less_or_equal(T2.join(T2.bottom(),deep),w));
  }

  // A non-decreasing chain over finitely many elements stabilizes under widening
  @Test public void testWideningReachesFixedPoint() {
    TreeDomain<Set<String>> T2 = new TreeDomain<>("T2",S,2,LogManager.getLogger(TestTreeDomain.class));
    Tree<Set<String>> w = T2.bottom();
    ArrayList<Label> path = new ArrayList<>();
    for( int i=1; i<=20; i++ ) {
      path.add(Label.field("a"));
      Tree<Set<String>> next = T2.join(w,T2.prepend(path,T2.create_leaf(set("x"+(i%3)))));
      Tree<Set<String>> prev = w;
      w = T2.widen(i,prev,next);
      assertTrue(T2.less_or_equal(next,w));
      assertTrue(T2.max_depth(w) <= 2);
      if( i > 6 ) assertTrue(T2.equal(prev,w));
    }
  }

  @Test public void testShape() {
    Tree<Set<String>> t = T.join(at(p("a","b"),"x"),at(p("c"),"y"));
    Tree<Set<String>> mold = at(p("a"),"z");
    Tree<Set<String>> shaped = T.shape(t,mold);
    assertEquals(T.join(leaf("y"),at(p("a"),"x")),shaped);
    assertTrue(T.less_or_equal(t,shaped));
  }

  @Test public void testWidenPolicies() {
    Tree<Set<String>> prev = at(p("a"),"x");
    Tree<Set<String>> next = T.join(prev,at(p("b","c"),"y"));
    Tree<Set<String>> plain = T.widen(TreeDomain.WidenPolicy.WIDEN_ONLY,1,prev,next);
    assertEquals(T.widen(1,prev,next),plain);
    // Shaping to prev folds the new [b] branch into the root
    Tree<Set<String>> shaped = T.widen(TreeDomain.WidenPolicy.SHAPE_THEN_WIDEN,1,prev,next);
    assertEquals(T.join(leaf("y"),at(p("a"),"x")),shaped);
    assertEquals(shaped,T.widen(TreeDomain.WidenPolicy.WIDEN_THEN_SHAPE,1,prev,next));
    for( Tree<Set<String>> w : List.of(plain,shaped) ) {
      assertTrue(T.less_or_equal(prev,w));
      assertTrue(T.less_or_equal(next,w));
    }
    // No mold yet: only widening
    assertEquals(T.widen(1,T.bottom(),next),T.widen(TreeDomain.WidenPolicy.SHAPE_THEN_WIDEN,1,T.bottom(),next));
  }

  @Test public void testPathParts() {
    Tree<Set<String>> t = T.join(leaf("r"),at(p("a"),"x"));
    TreeMap<String,Set<String>> paths = T.fold(T.PATH,(pv,acc) -> { acc.put(Label.show_path(pv._path),pv._element); return acc; },new TreeMap<String,Set<String>>(),t);
    assertEquals(set("r"),paths.get(""));
    assertEquals(set("r","x"),paths.get("[a]"));   // Joined with ancestors

    List<String> raw = T.fold(T.RAW_PATH,(rp,acc) -> { acc.add(Label.show_path(rp._path)+"="+S.show(rp._ancestors)+"/"+S.show(rp._tip)); return acc; },new ArrayList<String>(),t);
    assertEquals(List.of("={}/{r}","[a]={r}/{x}"),raw);

    Map<Boolean,Tree<Set<String>>> parts = T.partition(T.PATH,pv -> pv._path.isEmpty(),t);
    assertEquals(leaf("r"),parts.get(true));
    assertEquals(at(p("a"),"x"),parts.get(false));

    // Move everything to the root
    Tree<Set<String>> moved = T.transform(T.RAW_PATH,Transform.map(rp -> new TreeDomain.RawPath<>(List.of(),rp._ancestors,rp._tip)),t);
    assertEquals(leaf("r","x"),moved);
  }

  @Test public void testLiftedElementPart() {
    Part<Tree<Set<String>>,String> elem = T.lift(S.ELEMENT);
    Tree<Set<String>> t = T.join(leaf("r"),at(p("a"),"x","yy"));
    assertEquals(T.join(leaf("R"),at(p("a"),"X","YY")),T.transform(elem,Transform.map(String::toUpperCase),t));
    assertEquals(T.join(leaf("r"),at(p("a"),"x")),T.transform(elem,Transform.filter(s -> s.length()==1),t));
    assertEquals(Integer.valueOf(3),T.fold(elem,(s,n) -> n+1,0,t));
    assertTrue(T.parts().contains(elem));
  }

  @Test public void testFilterMapTreePaths() {
    Tree<Set<String>> t = T.join(at(p("a"),"x"),at(p("b"),"y"));
    Tree<Set<String>> res = T.filter_map_tree_paths(t,(path,anc,e) -> path.equals(p("a")) ? null : new TreeDomain.PathValue<>(p("c"),e));
    assertEquals(at(p("c"),"y"),res);
  }

  @Test public void testStructure() {
    assertEquals(List.of("T Tree (depth 4) ->","  S"),T.structure());
    assertEquals("{x}{[a] -> {y}}",T.show(T.join(leaf("x"),at(p("a"),"y"))));
  }
}
