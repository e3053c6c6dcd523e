package com.cliffc.taint.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing of
 *  lattice values, trees and structure dumps. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB() { _sb = new StringBuilder(); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally call the boxed version.
  public SB pobj( Object s ) { _sb.append(s.toString()); return this; }
  public SB i( int d ) { for( int i=0; i<d+_indent; i++ ) p("  "); return this; }
  public SB i( ) { return i(0); }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  public SB ii() { return ii(1); }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }
  public SB di() { return di(1); }

  public SB nl( ) { return p('\n'); }

  // Separator-joined print of any iterable
  public <E> SB p( Iterable<E> es, String sep ) {
    boolean first=true;
    for( E e : es ) {
      if( !first ) p(sep);
      first=false;
      pobj(e);
    }
    return this;
  }

  @Override public String toString() { return _sb.toString(); }
}
