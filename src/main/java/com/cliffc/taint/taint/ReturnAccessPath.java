package com.cliffc.taint.taint;

import com.cliffc.taint.domain.Label;

import java.util.List;

/** The part of the return value a parameter flows into.  A shorter path
 *  covers every longer one it prefixes; the empty path covers everything. */
public final class ReturnAccessPath implements Comparable<ReturnAccessPath> {
  public static final ReturnAccessPath ROOT = new ReturnAccessPath(List.of());

  public final List<Label> _path;
  private ReturnAccessPath( List<Label> path ) { _path = path; }
  public static ReturnAccessPath of( List<Label> path ) { return path.isEmpty() ? ROOT : new ReturnAccessPath(List.copyOf(path)); }

  public ReturnAccessPath extend( List<Label> rest, int max_length ) {
    return rest.isEmpty() ? this : of(Label.truncate(Label.append(_path,rest),max_length));
  }
  public ReturnAccessPath truncate( int max_length ) {
    return _path.size() <= max_length ? this : of(Label.truncate(_path,max_length));
  }
  // this is covered by that
  public boolean less_or_equal( ReturnAccessPath that ) { return Label.is_prefix(that._path,_path); }

  @Override public int compareTo( ReturnAccessPath r ) { return Label.compare_path(_path,r._path); }
  @Override public boolean equals( Object o ) { return o instanceof ReturnAccessPath r && _path.equals(r._path); }
  @Override public int hashCode() { return _path.hashCode(); }
  @Override public String toString() { return "ReturnAccessPath"+Label.show_path(_path); }
}
