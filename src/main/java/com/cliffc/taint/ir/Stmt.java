package com.cliffc.taint.ir;

import com.cliffc.taint.util.SB;

/** Straight-line statements. */
public abstract class Stmt {
  public final Expr _expr;
  Stmt( Expr expr ) { _expr = expr; }
  public abstract SB str( SB sb );
  @Override public String toString() { return str(new SB()).toString(); }

  public static Assign assign( String local, Expr e ) { return new Assign(local,e); }
  public static Eval eval( Expr e ) { return new Eval(e); }
  public static Return ret( Expr e ) { return new Return(e); }

  public static final class Assign extends Stmt {
    public final String _local;
    Assign( String local, Expr e ) { super(e); _local = local; }
    @Override public SB str( SB sb ) { return _expr.str(sb.p('$').p(_local).p(" = ")); }
  }
  public static final class Eval extends Stmt {
    Eval( Expr e ) { super(e); }
    @Override public SB str( SB sb ) { return _expr.str(sb); }
  }
  public static final class Return extends Stmt {
    Return( Expr e ) { super(e); }
    @Override public SB str( SB sb ) { return _expr.str(sb.p("return ")); }
  }
}
