package com.cliffc.taint.taint;

/** A named taint kind: a source kind (e.g. {@code UserControlled}), a sink
 *  kind (e.g. {@code RemoteCodeExecution}), or one of the special kinds
 *  used by the analysis itself. */
public final class Kind implements Comparable<Kind> {
  // Marks taint-in-taint-out: the value flows to the callable's return
  public static final Kind LOCAL_RETURN = new Kind("LocalReturn");
  // Sink on every argument of a callable without a body
  public static final Kind OBSCURE = new Kind("Obscure");

  public final String _name;
  private Kind( String name ) { _name = name; }
  public static Kind named( String name ) {
    if( name.equals(LOCAL_RETURN._name) ) return LOCAL_RETURN;
    if( name.equals(OBSCURE._name) ) return OBSCURE;
    return new Kind(name);
  }

  @Override public int compareTo( Kind k ) { return _name.compareTo(k._name); }
  @Override public boolean equals( Object o ) { return o instanceof Kind k && _name.equals(k._name); }
  @Override public int hashCode() { return _name.hashCode(); }
  @Override public String toString() { return _name; }
}
