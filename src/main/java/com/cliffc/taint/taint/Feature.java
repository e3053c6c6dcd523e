package com.cliffc.taint.taint;

/** A breadcrumb recorded on a flow. */
public final class Feature implements Comparable<Feature> {
  public static final Feature TITO = new Feature("tito");
  public static final Feature OBSCURE = new Feature("obscure");

  public final String _name;
  private Feature( String name ) { _name = name; }
  public static Feature via( String what ) { return new Feature("via:"+what); }

  @Override public int compareTo( Feature f ) { return _name.compareTo(f._name); }
  @Override public boolean equals( Object o ) { return o instanceof Feature f && _name.equals(f._name); }
  @Override public int hashCode() { return _name.hashCode(); }
  @Override public String toString() { return _name; }
}
