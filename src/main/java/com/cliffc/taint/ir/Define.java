package com.cliffc.taint.ir;

import com.cliffc.taint.fixpoint.Target;
import com.cliffc.taint.util.SB;

import java.util.List;

/** A callable: its parameters and, unless it is a stub, a body. */
public final class Define {
  public final Target _target;
  public final List<String> _params;
  public final List<Stmt> _body;        // Null for stubs

  private Define( Target target, List<String> params, List<Stmt> body ) {
    _target = target;
    _params = List.copyOf(params);
    _body = body==null ? null : List.copyOf(body);
  }
  public static Define define( Target target, List<String> params, Stmt... body ) { return new Define(target,params,List.of(body)); }
  // A callable whose body is not available
  public static Define stub( Target target, String... params ) { return new Define(target,List.of(params),null); }

  public boolean is_stub() { return _body==null; }
  public int param_index( String p ) { return _params.indexOf(p); }

  public SB str( SB sb ) {
    sb.p("def ").p(_target.toString()).p('(').p(_params,", ").p(')');
    if( is_stub() ) return sb.p(": ...").nl();
    sb.p(':').nl().ii();
    for( Stmt s : _body ) s.str(sb.i()).nl();
    return sb.di();
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
