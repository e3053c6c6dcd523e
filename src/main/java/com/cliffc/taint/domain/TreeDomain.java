package com.cliffc.taint.domain;

import com.cliffc.taint.util.SB;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/** Access-path trees over an element domain.

    A tree maps paths (lists of {@link Label}s) to elements.  The value at a
    path is split in two: the exact "tip" contribution stored at the node,
    and the "ancestors" contribution, the join of all elements stored along
    the spine above it.  Ancestor elements are visible to every descendant,
    so trees are kept minimal: no node stores an element already covered by
    its ancestors, and no node is empty.

    An {@link Label#ANY} child stands for every field not explicitly present;
    {@link Label#KEYS} is never matched by {@code ANY}.

    Widening joins element-wise with the element widen and collapses every
    subtree below {@code max_tree_depth_after_widening} into its node at
    that depth.
 */
public class TreeDomain<E> extends Domain<Tree<E>> {
  public static final int DEFAULT_MAX_TREE_DEPTH = 4;
  static final int NO_WIDEN = -1;

  public final Domain<E> _elem;
  public final int _max_depth;
  final Logger _log;
  private final Tree<E> _bottom;
  public final Part<Tree<E>,PathValue<E>> PATH;
  public final Part<Tree<E>,RawPath<E>> RAW_PATH;

  /** A path paired with the effective value there (ancestors joined with tip). */
  public static final class PathValue<E> {
    public final List<Label> _path;
    public final E _element;
    public PathValue( List<Label> path, E element ) { _path = path; _element = element; }
    @Override public boolean equals( Object o ) { return o instanceof PathValue<?> pv && _path.equals(pv._path) && _element.equals(pv._element); }
    @Override public int hashCode() { return _path.hashCode()*31+_element.hashCode(); }
    @Override public String toString() { return Label.show_path(_path)+" -> "+_element; }
  }
  /** A path with its inherited and exact contributions kept apart. */
  public static final class RawPath<E> {
    public final List<Label> _path;
    public final E _ancestors;
    public final E _tip;
    public RawPath( List<Label> path, E ancestors, E tip ) { _path = path; _ancestors = ancestors; _tip = tip; }
    @Override public String toString() { return Label.show_path(_path)+" -> "+_ancestors+" / "+_tip; }
  }

  public TreeDomain( String name, Domain<E> elem ) { this(name,elem,DEFAULT_MAX_TREE_DEPTH,LogManager.getLogger(TreeDomain.class)); }
  public TreeDomain( String name, Domain<E> elem, int max_tree_depth_after_widening, Logger log ) {
    super(name);
    _elem = elem;
    _max_depth = max_tree_depth_after_widening;
    _log = log;
    _bottom = new Tree<>(elem.bottom());
    PATH = new PathPart();
    RAW_PATH = new RawPathPart();
  }

  // ----------------------------------------------------------
  // Small helpers.  Internally a null tree means "no tree".
  private boolean is_empty( Tree<E> t ) { return t._children.isEmpty() && _elem.is_bottom(t._element); }
  private Tree<E> or_bottom( Tree<E> t ) { return t==null ? _bottom : t; }
  private Tree<E> node( E element, SortedMap<Label,Tree<E>> children ) {
    return children.isEmpty() && _elem.is_bottom(element) ? null : new Tree<>(element,children);
  }
  private static <E> void set_or_remove( TreeMap<Label,Tree<E>> kids, Label l, Tree<E> t ) {
    if( t==null ) kids.remove(l);
    else kids.put(l,t);
  }
  private Tree<E> create_tree( List<Label> path, int i, Tree<E> t ) {
    if( i==path.size() ) return t;
    TreeMap<Label,Tree<E>> kids = new TreeMap<>();
    kids.put(path.get(i),create_tree(path,i+1,t));
    return new Tree<>(_elem.bottom(),kids);
  }
  private Tree<E> create_tree_opt( List<Label> path, Tree<E> t ) {
    return t==null || is_empty(t) ? null : create_tree(path,0,t);
  }

  // Widen depth: NO_WIDEN, or the number of levels below which to collapse
  private E element_join( int wd, E a, E b ) {
    return wd==NO_WIDEN ? _elem.join(a,b) : _elem.widen(2,a,b);
  }
  private static int decrement( int wd ) {
    assert wd != 0;
    return wd==NO_WIDEN ? NO_WIDEN : wd-1;
  }

  // Join of every element in the tree
  private E collapse_tree( int wd, E acc, Tree<E> t ) {
    acc = element_join(wd,acc,t._element);
    for( Tree<E> kid : t._children.values() )
      acc = collapse_tree(wd,acc,kid);
    return acc;
  }

  // The element contribution not already covered by ancestors, and the new ancestors.
  private final class Filtered {
    final E _new_element, _ancestors;
    Filtered( E ancestors, E element ) {
      E diff = _elem.subtract(ancestors,element);
      if( _elem.less_or_equal(diff,ancestors) ) {
        _new_element = _elem.bottom();
        _ancestors = ancestors;
      } else {
        _new_element = diff;
        _ancestors = _elem.join(ancestors,element);
      }
    }
  }

  private Tree<E> prune( E ancestors, Tree<E> t ) {
    Filtered f = new Filtered(ancestors,t._element);
    TreeMap<Label,Tree<E>> kids = new TreeMap<>();
    for( Map.Entry<Label,Tree<E>> e : t._children.entrySet() )
      set_or_remove(kids,e.getKey(),prune(f._ancestors,e.getValue()));
    return node(f._new_element,kids);
  }

  // ----------------------------------------------------------
  // Join.  When widening, the right side does not extend the tree past the
  // depth limit and elements use widen.
  private Tree<E> join_trees( E ancestors, int wd, Tree<E> l, Tree<E> r ) {
    if( wd==0 ) {
      // Collapse both sides to meet the depth limit
      E collapsed = collapse_tree(wd,collapse_tree(wd,_elem.bottom(),l),r);
      E diff = _elem.subtract(ancestors,collapsed);
      return _elem.less_or_equal(diff,ancestors) ? null : new Tree<>(diff);
    }
    E joined = element_join(wd,l._element,r._element);
    Filtered f = new Filtered(ancestors,joined);
    return node(f._new_element,join_children(f._ancestors,decrement(wd),l._children,r._children));
  }

  private Tree<E> join_opt( E ancestors, int wd, Tree<E> l, Tree<E> r ) {
    if( l==null && r==null ) return null;
    if( r==null ) return wd==NO_WIDEN ? prune(ancestors,l) : join_trees(ancestors,wd,l,_bottom);
    if( l==null ) return wd==NO_WIDEN ? prune(ancestors,r) : join_trees(ancestors,wd,_bottom,r);
    return join_trees(ancestors,wd,l,r);
  }

  // Star semantics: a field present on one side only is joined with the
  // other side's [*] subtree.  [*] joins [*]; [**keys] joins only [**keys].
  private SortedMap<Label,Tree<E>> join_children( E ancestors, int wd, SortedMap<Label,Tree<E>> lkids, SortedMap<Label,Tree<E>> rkids ) {
    Tree<E> lstar = lkids.get(Label.ANY), rstar = rkids.get(Label.ANY);
    TreeMap<Label,Tree<E>> res = new TreeMap<>();
    for( Map.Entry<Label,Tree<E>> e : lkids.entrySet() ) {
      Label l = e.getKey();
      Tree<E> right = rkids.get(l);
      Tree<E> joined = switch( l._kind ) {
      case ANY   -> join_opt(ancestors,wd,e.getValue(),rstar);
      case FIELD -> right!=null ? join_trees(ancestors,wd,e.getValue(),right) : join_opt(ancestors,wd,e.getValue(),rstar);
      case KEYS  -> right!=null ? join_trees(ancestors,wd,e.getValue(),right) : join_opt(ancestors,wd,e.getValue(),null);
      };
      set_or_remove(res,l,joined);
    }
    for( Map.Entry<Label,Tree<E>> e : rkids.entrySet() ) {
      Label l = e.getKey();
      if( lkids.containsKey(l) ) continue; // Done pointwise above
      Tree<E> joined = l.is_field()
        ? join_opt(ancestors,wd,lstar,e.getValue())
        : join_opt(ancestors,wd,null ,e.getValue());
      set_or_remove(res,l,joined);
    }
    return res;
  }

  @Override public Tree<E> bottom() { return _bottom; }
  @Override public boolean is_bottom( Tree<E> t ) { return is_empty(t); }

  @Override public Tree<E> join( Tree<E> l, Tree<E> r ) {
    if( l==r ) return l;
    Tree<E> res = or_bottom(join_trees(_elem.bottom(),NO_WIDEN,l,r));
    assert is_minimal(res);
    return res;
  }

  @Override public Tree<E> widen( int iteration, Tree<E> prev, Tree<E> next ) {
    Tree<E> res = or_bottom(join_trees(_elem.bottom(),_max_depth,prev,next));
    if( _log.isDebugEnabled() && Math.max(max_depth(prev),max_depth(next)) > _max_depth )
      _log.debug("{}: widened tree of depth {} to depth {}", _name, Math.max(max_depth(prev),max_depth(next)), max_depth(res));
    return res;
  }

  /** Where restricting to the previous tree's shape happens relative to
   *  depth widening.  Shaping trades precision for fewer distinct paths. */
  public enum WidenPolicy { WIDEN_ONLY, SHAPE_THEN_WIDEN, WIDEN_THEN_SHAPE }

  /** Widen under a policy; the previous tree is the mold.  A bottom previous
   *  tree has no shape yet, so only widening applies. */
  public Tree<E> widen( WidenPolicy policy, int iteration, Tree<E> prev, Tree<E> next ) {
    if( policy==WidenPolicy.WIDEN_ONLY || is_empty(prev) ) return widen(iteration,prev,next);
    return switch( policy ) {
    case SHAPE_THEN_WIDEN -> widen(iteration,prev,shape(next,prev));
    case WIDEN_THEN_SHAPE -> shape(widen(iteration,prev,next),prev);
    default -> throw new IllegalStateException("Unknown policy "+policy);
    };
  }

  // ----------------------------------------------------------
  @Override public boolean less_or_equal( Tree<E> l, Tree<E> r ) {
    return l==r || le_tree(l,_elem.bottom(),r);
  }
  private boolean le_tree( Tree<E> l, E ranc, Tree<E> r ) {
    ranc = _elem.join(ranc,r._element);
    return _elem.less_or_equal(l._element,ranc) && le_children(l._children,ranc,r._children);
  }
  private boolean le_opt( Tree<E> l, E ranc, Tree<E> r ) {
    if( l==null ) return true;
    return le_tree(l,ranc,r==null ? _bottom : r);
  }
  private boolean le_children( SortedMap<Label,Tree<E>> lkids, E ranc, SortedMap<Label,Tree<E>> rkids ) {
    if( lkids.isEmpty() ) return true;
    if( rkids.isEmpty() ) {
      // Everything on the left must be below the right ancestors
      for( Tree<E> l : lkids.values() )
        if( !le_tree(l,ranc,_bottom) )
          return false;
      return true;
    }
    Tree<E> lstar = lkids.get(Label.ANY), rstar = rkids.get(Label.ANY);
    for( Map.Entry<Label,Tree<E>> e : lkids.entrySet() ) {
      Label l = e.getKey();
      Tree<E> right = rkids.get(l);
      boolean ok = switch( l._kind ) {
      case ANY   -> le_opt(lstar,ranc,rstar);
      case FIELD -> right==null ? le_opt(e.getValue(),ranc,rstar) : le_tree(e.getValue(),ranc,right);
      case KEYS  -> le_opt(e.getValue(),ranc,right);
      };
      if( !ok ) return false;
    }
    // Fields only on the right must be above the left [*]
    for( Map.Entry<Label,Tree<E>> e : rkids.entrySet() )
      if( e.getKey().is_field() && !lkids.containsKey(e.getKey()) && !le_opt(lstar,ranc,e.getValue()) )
        return false;
    return true;
  }

  // Not precise, but sound: all or nothing.
  @Override public Tree<E> subtract( Tree<E> to_remove, Tree<E> from ) {
    return to_remove==from || less_or_equal(from,to_remove) ? _bottom : from;
  }

  // ----------------------------------------------------------
  public Tree<E> create_leaf( E e ) { return _elem.is_bottom(e) ? _bottom : new Tree<>(e); }
  /** Graft tree as a subtree rooted at path. */
  public Tree<E> prepend( List<Label> path, Tree<E> t ) { return or_bottom(create_tree_opt(path,t)); }
  public E get_root( Tree<E> t ) { return t._element; }

  /** Replace the content at path with subtree; a weak assign joins instead. */
  public Tree<E> assign( Tree<E> t, List<Label> path, Tree<E> subtree, boolean weak ) {
    return or_bottom(assign_or_join(weak,_elem.bottom(),t,path,0,subtree));
  }
  public Tree<E> assign( Tree<E> t, List<Label> path, Tree<E> subtree ) { return assign(t,path,subtree,false); }

  private Tree<E> assign_or_join( boolean do_join, E ancestors, Tree<E> t, List<Label> path, int i, Tree<E> subtree ) {
    if( is_empty(t) ) {
      Tree<E> pruned = prune(ancestors,subtree);
      return pruned==null ? null : create_tree(path,i,pruned);
    }
    if( i==path.size() )
      return do_join
        ? join_trees(ancestors,NO_WIDEN,t,subtree)
        : prune(ancestors,subtree); // Overwrites t's own element too
    Label l = path.get(i);
    E anc = _elem.join(ancestors,t._element);
    TreeMap<Label,Tree<E>> kids = t.children();
    if( l._kind==Label.Kind.ANY ) {
      // Unknown index: weakly update [*] and every field it may stand for
      for( Map.Entry<Label,Tree<E>> e : t.children().entrySet() ) {
        if( e.getKey()._kind==Label.Kind.KEYS ) continue;
        set_or_remove(kids,e.getKey(),assign_or_join(true,anc,e.getValue(),path,i+1,subtree));
      }
      if( !t._children.containsKey(Label.ANY) )
        set_or_remove(kids,Label.ANY,assign_or_join(true,anc,_bottom,path,i+1,subtree));
    } else {
      Tree<E> existing = or_bottom(t.child(l));
      set_or_remove(kids,l,assign_or_join(do_join,anc,existing,path,i+1,subtree));
    }
    return node(t._element,kids);
  }

  // ----------------------------------------------------------
  /** The effective value at path: the join of all ancestor contributions
   *  down to path with the subtree there.  transform_non_leaves rewrites each
   *  element met above the path, given the remaining path from that node. */
  public @NotNull Tree<E> read( List<Label> path, Tree<E> t, BiFunction<List<Label>,E,E> transform_non_leaves ) {
    Read r = new Read(transform_non_leaves);
    Tree<E> sub = r.read(_elem.bottom(),path,0,t);
    return or_bottom(join_trees(_elem.bottom(),NO_WIDEN,create_leaf(r._ancestors),or_bottom(sub)));
  }
  public Tree<E> read( List<Label> path, Tree<E> t ) { return read(path,t,(p,e) -> e); }

  // Accumulates the ancestors seen along the read
  private final class Read {
    final BiFunction<List<Label>,E,E> _xform;
    E _ancestors;
    Read( BiFunction<List<Label>,E,E> xform ) { _xform = xform; _ancestors = _elem.bottom(); }
    Tree<E> read( E ancestors, List<Label> path, int i, Tree<E> t ) {
      if( i==path.size() ) {
        _ancestors = _elem.join(_ancestors,ancestors);
        return node(t._element,t._children);
      }
      Label l = path.get(i);
      E anc = _elem.join(ancestors,_xform.apply(path.subList(i,path.size()),t._element));
      switch( l._kind ) {
      case ANY: {
        // Read every index except the dictionary keys, and join
        Tree<E> acc = null;
        _ancestors = _elem.join(_ancestors,anc);
        for( Map.Entry<Label,Tree<E>> e : t._children.entrySet() ) {
          if( e.getKey()._kind==Label.Kind.KEYS ) continue;
          Tree<E> sub = read(anc,path,i+1,e.getValue());
          acc = join_opt(_elem.bottom(),NO_WIDEN,acc,sub);
        }
        return acc;
      }
      case FIELD: {
        Tree<E> kid = t.child(l);
        if( kid==null ) kid = t.child(Label.ANY);
        if( kid==null ) { _ancestors = _elem.join(_ancestors,anc); return null; }
        return read(anc,path,i+1,kid);
      }
      default: {
        Tree<E> kid = t.child(l);
        if( kid==null ) { _ancestors = _elem.join(_ancestors,anc); return null; }
        return read(anc,path,i+1,kid);
      }
      }
    }
  }

  // ----------------------------------------------------------
  /** Length of the longest path. */
  public int max_depth( Tree<E> t ) {
    int d = 0;
    for( Tree<E> kid : t._children.values() )
      d = Math.max(d,1+max_depth(kid));
    return d;
  }
  /** Length of the shortest path to a non-bottom element. */
  public int min_depth( Tree<E> t ) {
    if( !_elem.is_bottom(t._element) || t._children.isEmpty() ) return 0;
    int d = Integer.MAX_VALUE;
    for( Tree<E> kid : t._children.values() )
      d = Math.min(d,1+min_depth(kid));
    return d;
  }

  /** Join of every element in the tree, discarding the paths. */
  public E collapse( Tree<E> t ) {
    E e = collapse_tree(NO_WIDEN,_elem.bottom(),t);
    if( _log.isTraceEnabled() && !t._children.isEmpty() )
      _log.trace("{}: collapsed tree of depth {}", _name, max_depth(t));
    return e;
  }

  /** Fold everything below depth upward into the nodes at depth. */
  public Tree<E> collapse_to( int depth, Tree<E> t ) {
    if( _log.isDebugEnabled() && max_depth(t) > depth )
      _log.debug("{}: collapsing tree of depth {} to {}", _name, max_depth(t), depth);
    return or_bottom(join_trees(_elem.bottom(),depth,t,t));
  }

  /** Drop everything below depth. */
  public Tree<E> cut_tree_after( int depth, Tree<E> t ) {
    return filter_map_tree_paths(t,(path,ancestors,element) -> path.size() > depth ? null : new PathValue<>(path,element));
  }

  /** Restrict t to the branches present in mold, joining the pruned
   *  branches into their nearest retained ancestor. */
  public @NotNull Tree<E> shape( Tree<E> t, Tree<E> mold ) {
    return or_bottom(shape_tree(_elem.bottom(),t,mold));
  }
  private Tree<E> shape_tree( E ancestors, Tree<E> t, Tree<E> mold ) {
    E lifted = t._element;
    TreeMap<Label,Tree<E>> kept = new TreeMap<>();
    for( Map.Entry<Label,Tree<E>> e : t._children.entrySet() ) {
      Tree<E> m = mold.child(e.getKey());
      if( m==null ) lifted = _elem.join(lifted,collapse_tree(NO_WIDEN,_elem.bottom(),e.getValue()));
      else kept.put(e.getKey(),e.getValue());
    }
    Filtered f = new Filtered(ancestors,lifted);
    TreeMap<Label,Tree<E>> kids = new TreeMap<>();
    for( Map.Entry<Label,Tree<E>> e : kept.entrySet() )
      set_or_remove(kids,e.getKey(),shape_tree(f._ancestors,e.getValue(),mold.child(e.getKey())));
    return node(f._new_element,kids);
  }

  // ----------------------------------------------------------
  public interface PathVisitor<E,B> { B apply( List<Label> path, E ancestors, E element, B acc ); }
  public interface PathMapper<E> { PathValue<E> apply( List<Label> path, E ancestors, E element ); }

  /** Visit every non-bottom element, preorder, with its path and the join of the elements above it. */
  public <B> B fold_tree_paths( Tree<E> t, B init, PathVisitor<E,B> f ) {
    return walk(List.of(),_elem.bottom(),t,init,f);
  }
  private <B> B walk( List<Label> path, E ancestors, Tree<E> t, B acc, PathVisitor<E,B> f ) {
    if( !_elem.is_bottom(t._element) )
      acc = f.apply(path,ancestors,t._element,acc);
    E anc = _elem.join(ancestors,t._element);
    for( Map.Entry<Label,Tree<E>> e : t._children.entrySet() )
      acc = walk(Label.append(path,e.getKey()),anc,e.getValue(),acc,f);
    return acc;
  }

  /** Rebuild the tree from every non-bottom element, each possibly moved or
   *  rewritten; a null or bottom result drops the element. */
  public Tree<E> filter_map_tree_paths( Tree<E> t, PathMapper<E> f ) {
    Tree<E> res = fold_tree_paths(t,_bottom,(path,ancestors,element,acc) -> {
        PathValue<E> pv = f.apply(path,ancestors,element);
        if( pv==null || _elem.is_bottom(pv._element) ) return acc;
        return join(acc,prepend(pv._path,create_leaf(pv._element)));
      });
    assert is_minimal(res);
    return res;
  }

  // No empty leaves, and no element already covered by its ancestors
  boolean is_minimal( Tree<E> t ) { return is_empty(t) || minimal(_elem.bottom(),t); }
  private boolean minimal( E ancestors, Tree<E> t ) {
    if( is_empty(t) ) return false;
    if( !_elem.is_bottom(t._element) && _elem.less_or_equal(t._element,ancestors) ) return false;
    E anc = _elem.join(ancestors,t._element);
    for( Tree<E> kid : t._children.values() )
      if( !minimal(anc,kid) )
        return false;
    return true;
  }

  // ----------------------------------------------------------
  /** Lift a part of the element domain to apply at every node of a tree. */
  public <A> Part<Tree<E>,A> lift( Part<E,A> part ) { return new ElementPart<>(part); }

  @Override public List<Part<Tree<E>,?>> parts() {
    ArrayList<Part<Tree<E>,?>> ps = new ArrayList<>(List.of(SELF,PATH,RAW_PATH));
    for( Part<E,?> p : _elem.parts() ) ps.add(lift(p));
    return ps;
  }
  @Override public List<String> structure() {
    ArrayList<String> ss = new ArrayList<>();
    ss.add(_name+" Tree (depth "+_max_depth+") ->");
    for( String s : _elem.structure() ) ss.add("  "+s);
    return ss;
  }
  @Override public String show( Tree<E> t ) {
    if( is_empty(t) ) return "{}";
    return show(new SB(),t).toString();
  }
  private SB show( SB sb, Tree<E> t ) {
    if( !_elem.is_bottom(t._element) ) sb.p(_elem.show(t._element));
    if( t._children.isEmpty() ) return sb;
    sb.p('{');
    boolean first = true;
    for( Map.Entry<Label,Tree<E>> e : t._children.entrySet() ) {
      if( !first ) sb.p(", ");
      first = false;
      show(sb.p(e.getKey().toString()).p(" -> "),e.getValue());
    }
    return sb.p('}');
  }

  // Group paths by key, one tree per key
  private <K> void put_path( Map<K,Tree<E>> res, K key, List<Label> path, E element ) {
    if( key==null ) return;
    Tree<E> t = prepend(path,create_leaf(element));
    Tree<E> existing = res.get(key);
    res.put(key,existing==null ? t : join(existing,t));
  }

  private final class PathPart extends Part<Tree<E>,PathValue<E>> {
    PathPart() { super(TreeDomain.this._name+".Path"); }
    @Override public Tree<E> map( Tree<E> t, Function<PathValue<E>,PathValue<E>> f ) {
      return filter_map_tree_paths(t,(path,anc,e) -> f.apply(new PathValue<>(path,_elem.join(anc,e))));
    }
    @Override public Tree<E> filter( Tree<E> t, Predicate<PathValue<E>> p ) {
      return filter_map_tree_paths(t,(path,anc,e) -> p.test(new PathValue<>(path,_elem.join(anc,e))) ? new PathValue<>(path,e) : null);
    }
    @Override public Tree<E> add( Tree<E> t, PathValue<E> pv ) { return join(t,prepend(pv._path,create_leaf(pv._element))); }
    @Override public <B> B fold( Tree<E> t, BiFunction<PathValue<E>,B,B> f, B init ) {
      return fold_tree_paths(t,init,(path,anc,e,acc) -> f.apply(new PathValue<>(path,_elem.join(anc,e)),acc));
    }
    @Override public <K> Map<K,Tree<E>> partition( Tree<E> t, Function<PathValue<E>,K> f ) {
      HashMap<K,Tree<E>> res = new HashMap<>();
      fold_tree_paths(t,res,(path,anc,e,acc) -> { put_path(acc,f.apply(new PathValue<>(path,_elem.join(anc,e))),path,e); return acc; });
      return res;
    }
  }

  private final class RawPathPart extends Part<Tree<E>,RawPath<E>> {
    RawPathPart() { super(TreeDomain.this._name+".RawPath"); }
    @Override public Tree<E> map( Tree<E> t, Function<RawPath<E>,RawPath<E>> f ) {
      return filter_map_tree_paths(t,(path,anc,e) -> {
          RawPath<E> rp = f.apply(new RawPath<>(path,anc,e));
          return new PathValue<>(rp._path,_elem.join(rp._ancestors,rp._tip));
        });
    }
    @Override public Tree<E> filter( Tree<E> t, Predicate<RawPath<E>> p ) {
      return filter_map_tree_paths(t,(path,anc,e) -> p.test(new RawPath<>(path,anc,e)) ? new PathValue<>(path,e) : null);
    }
    @Override public Tree<E> add( Tree<E> t, RawPath<E> rp ) { return join(t,prepend(rp._path,create_leaf(rp._tip))); }
    @Override public <B> B fold( Tree<E> t, BiFunction<RawPath<E>,B,B> f, B init ) {
      return fold_tree_paths(t,init,(path,anc,e,acc) -> f.apply(new RawPath<>(path,anc,e),acc));
    }
    @Override public <K> Map<K,Tree<E>> partition( Tree<E> t, Function<RawPath<E>,K> f ) {
      HashMap<K,Tree<E>> res = new HashMap<>();
      fold_tree_paths(t,res,(path,anc,e,acc) -> { put_path(acc,f.apply(new RawPath<>(path,anc,e)),path,e); return acc; });
      return res;
    }
  }

  // An element part, applied to the element at every node
  private final class ElementPart<A> extends Part<Tree<E>,A> {
    final Part<E,A> _inner;
    ElementPart( Part<E,A> inner ) { super(TreeDomain.this._name+"."+inner._name); _inner = inner; }
    @Override public Tree<E> map( Tree<E> t, Function<A,A> f ) {
      return filter_map_tree_paths(t,(path,anc,e) -> new PathValue<>(path,_inner.map(e,f)));
    }
    @Override public Tree<E> filter( Tree<E> t, Predicate<A> p ) {
      return filter_map_tree_paths(t,(path,anc,e) -> new PathValue<>(path,_inner.filter(e,p)));
    }
    // Added at the root
    @Override public Tree<E> add( Tree<E> t, A a ) { return join(t,create_leaf(_inner.add(_elem.bottom(),a))); }
    @Override public <B> B fold( Tree<E> t, BiFunction<A,B,B> f, B init ) {
      return fold_tree_paths(t,init,(path,anc,e,acc) -> _inner.fold(e,f,acc));
    }
    @Override public <K> Map<K,Tree<E>> partition( Tree<E> t, Function<A,K> f ) {
      HashMap<K,Tree<E>> res = new HashMap<>();
      fold_tree_paths(t,res,(path,anc,e,acc) -> {
          for( Map.Entry<K,E> kv : _inner.partition(e,f).entrySet() )
            put_path(acc,kv.getKey(),path,kv.getValue());
          return acc;
        });
      return res;
    }
    TreeDomain<E> owner() { return TreeDomain.this; }
    @Override public boolean equals( Object o ) {
      return o instanceof TreeDomain<?>.ElementPart<?> ep && ep.owner()==owner() && ep._inner.equals(_inner);
    }
    @Override public int hashCode() { return System.identityHashCode(owner())*31+_inner.hashCode(); }
  }
}
