package com.cliffc.taint.domain;

import com.cliffc.taint.util.SB;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One step of an access path: a named field, the key set of a dictionary,
 *  or an unknown index.  Labels sort fields first (by name), then the
 *  dictionary-keys marker, then the unknown index. */
public final class Label implements Comparable<Label> {
  public enum Kind { FIELD, KEYS, ANY }
  public final Kind _kind;
  public final String _name;    // Only for fields

  private Label( Kind kind, String name ) { _kind = kind; _name = name; }
  public static final Label KEYS = new Label(Kind.KEYS,null);
  public static final Label ANY  = new Label(Kind.ANY ,null);
  public static Label field( String name ) { return new Label(Kind.FIELD,name); }
  public static Label field( int i ) { return field(Integer.toString(i)); }

  public boolean is_field() { return _kind==Kind.FIELD; }

  @Override public int compareTo( Label l ) {
    int c = _kind.compareTo(l._kind);
    return c!=0 || _kind!=Kind.FIELD ? c : _name.compareTo(l._name);
  }
  @Override public boolean equals( Object o ) {
    return o instanceof Label l && _kind==l._kind && Objects.equals(_name,l._name);
  }
  @Override public int hashCode() { return _kind.hashCode()*31+Objects.hashCode(_name); }
  @Override public String toString() {
    return switch( _kind ) {
    case FIELD -> "["+_name+"]";
    case KEYS  -> "[**keys]";
    case ANY   -> "[*]";
    };
  }

  // ----------------------------------------------------------
  // Paths are plain immutable lists of labels, ordered by prefix.
  public static List<Label> path( Label... ls ) { return List.of(ls); }
  public static List<Label> path( String... fields ) {
    ArrayList<Label> ls = new ArrayList<>();
    for( String f : fields ) ls.add(field(f));
    return List.copyOf(ls);
  }
  public static List<Label> append( List<Label> path, List<Label> rest ) {
    if( rest.isEmpty() ) return path;
    ArrayList<Label> ls = new ArrayList<>(path);
    ls.addAll(rest);
    return List.copyOf(ls);
  }
  public static List<Label> append( List<Label> path, Label l ) { return append(path,List.of(l)); }

  public static String show_path( List<Label> path ) {
    SB sb = new SB();
    for( Label l : path ) sb.p(l.toString());
    return sb.toString();
  }

  public static List<Label> common_prefix( List<Label> l, List<Label> r ) {
    int i=0;
    while( i<l.size() && i<r.size() && l.get(i).equals(r.get(i)) ) i++;
    return List.copyOf(l.subList(0,i));
  }
  public static boolean is_prefix( List<Label> prefix, List<Label> path ) {
    return prefix.size() <= path.size() && prefix.equals(path.subList(0,prefix.size()));
  }
  public static int compare_path( List<Label> l, List<Label> r ) {
    for( int i=0; i<l.size() && i<r.size(); i++ ) {
      int c = l.get(i).compareTo(r.get(i));
      if( c!=0 ) return c;
    }
    return Integer.compare(l.size(),r.size());
  }
  public static List<Label> truncate( List<Label> path, int len ) {
    return path.size() <= len ? path : List.copyOf(path.subList(0,len));
  }
}
