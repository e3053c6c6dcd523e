package com.cliffc.taint.domain;

/** A part paired with one of its contents; the input to {@link Domain#create}. */
public final class PartValue<D,A> {
  public final Part<D,A> _part;
  public final A _value;
  private PartValue( Part<D,A> part, A value ) { _part = part; _value = value; }
  public static <D,A> PartValue<D,A> of( Part<D,A> part, A value ) { return new PartValue<>(part,value); }
  D add_to( D v ) { return _part.add_lax(v,_value); }
  @Override public String toString() { return _part+"="+_value; }
}
