package com.cliffc.taint.fixpoint;

import java.util.Objects;

/** Stable identifier of an analyzable callable.  An override target stands
 *  for a virtual call to a method: its model covers the method and every
 *  method overriding it. */
public final class Target implements Comparable<Target> {
  public enum Kind { FUNCTION, METHOD, OVERRIDE }
  public final Kind _kind;
  public final String _name;

  private Target( Kind kind, String name ) { _kind = kind; _name = name; }
  public static Target function( String name ) { return new Target(Kind.FUNCTION,name); }
  public static Target method( String cls, String name ) { return new Target(Kind.METHOD,cls+"."+name); }
  public static Target override( Target method ) {
    if( method._kind != Kind.METHOD ) throw new IllegalArgumentException("Only methods are overridden: "+method);
    return new Target(Kind.OVERRIDE,method._name);
  }

  public boolean is_override() { return _kind==Kind.OVERRIDE; }
  // The method an override target is based on
  public Target corresponding_method() { return _kind==Kind.OVERRIDE ? new Target(Kind.METHOD,_name) : this; }

  @Override public int compareTo( Target t ) {
    int c = _name.compareTo(t._name);
    return c!=0 ? c : _kind.compareTo(t._kind);
  }
  @Override public boolean equals( Object o ) { return o instanceof Target t && _kind==t._kind && _name.equals(t._name); }
  @Override public int hashCode() { return Objects.hash(_kind,_name); }
  @Override public String toString() { return _kind==Kind.OVERRIDE ? "Override{"+_name+"}" : _name; }
}
