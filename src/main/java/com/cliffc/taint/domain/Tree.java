package com.cliffc.taint.domain;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/** An access-path tree node: the element contributed exactly at this node
 *  (not the join from the root), plus labelled children.  Immutable.
 *  An {@link Label#ANY} child covers every field not explicitly present. */
public final class Tree<E> {
  public final E _element;
  public final SortedMap<Label,Tree<E>> _children;

  Tree( E element, SortedMap<Label,Tree<E>> children ) {
    _element = element;
    _children = children.isEmpty() ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(children);
  }
  Tree( E element ) { this(element,Collections.emptySortedMap()); }

  public Tree<E> child( Label l ) { return _children.get(l); }
  public boolean is_leaf() { return _children.isEmpty(); }
  // Mutable copy of the children, for building new nodes
  TreeMap<Label,Tree<E>> children() { return new TreeMap<>(_children); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Tree<?> t && Objects.equals(_element,t._element) && _children.equals(t._children);
  }
  @Override public int hashCode() { return Objects.hashCode(_element)*31+_children.hashCode(); }
  @Override public String toString() { return _element+(_children.isEmpty() ? "" : _children.toString()); }
}
