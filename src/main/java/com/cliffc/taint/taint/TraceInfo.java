package com.cliffc.taint.taint;

import com.cliffc.taint.fixpoint.Target;

import java.util.Objects;

/** Where a flow comes from: a user declaration, a location in the analyzed
 *  callable, or a call into a callee through one of its ports. */
public final class TraceInfo implements Comparable<TraceInfo> {
  public enum Tag { DECLARATION, ORIGIN, CALL_SITE }
  public static final TraceInfo DECLARATION = new TraceInfo(Tag.DECLARATION,null,null,0);

  public final Tag _tag;
  public final Target _callee;  // Call sites only
  public final String _port;    // Call sites only: "result" or a parameter
  public final int _line;

  private TraceInfo( Tag tag, Target callee, String port, int line ) { _tag = tag; _callee = callee; _port = port; _line = line; }
  public static TraceInfo origin( int line ) { return new TraceInfo(Tag.ORIGIN,null,null,line); }
  public static TraceInfo call_site( Target callee, String port, int line ) { return new TraceInfo(Tag.CALL_SITE,callee,port,line); }

  @Override public int compareTo( TraceInfo t ) { return toString().compareTo(t.toString()); }
  @Override public boolean equals( Object o ) {
    return o instanceof TraceInfo t && _tag==t._tag && _line==t._line && Objects.equals(_callee,t._callee) && Objects.equals(_port,t._port);
  }
  @Override public int hashCode() { return Objects.hash(_tag,_callee,_port,_line); }
  @Override public String toString() {
    return switch( _tag ) {
    case DECLARATION -> "Declaration";
    case ORIGIN -> "Origin(line "+_line+")";
    case CALL_SITE -> "CallSite("+_callee+", "+_port+", line "+_line+")";
    };
  }
}
