package com.cliffc.taint.ir;

import com.cliffc.taint.fixpoint.Target;
import com.cliffc.taint.util.SB;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Expressions of the analyzed callables: just enough structure to move
 *  values between parameters, locals, record fields and calls. */
public abstract class Expr {
  public abstract SB str( SB sb );
  @Override public String toString() { return str(new SB()).toString(); }

  public static Param param( String name ) { return new Param(name); }
  public static Local local( String name ) { return new Local(name); }
  public static Literal literal( String text ) { return new Literal(text); }
  public static Attribute attr( Expr base, String field ) { return new Attribute(base,field); }
  public static Call call( int line, Target callee, Expr... args ) { return new Call(callee,List.of(args),line); }
  public static Record record( Object... names_and_exprs ) {
    assert (names_and_exprs.length&1)==0;
    LinkedHashMap<String,Expr> fs = new LinkedHashMap<>();
    for( int i=0; i<names_and_exprs.length; i+=2 )
      fs.put((String)names_and_exprs[i],(Expr)names_and_exprs[i+1]);
    return new Record(fs);
  }

  public static final class Param extends Expr {
    public final String _name;
    Param( String name ) { _name = name; }
    @Override public SB str( SB sb ) { return sb.p(_name); }
  }
  public static final class Local extends Expr {
    public final String _name;
    Local( String name ) { _name = name; }
    @Override public SB str( SB sb ) { return sb.p('$').p(_name); }
  }
  // Constants carry no taint
  public static final class Literal extends Expr {
    public final String _text;
    Literal( String text ) { _text = text; }
    @Override public SB str( SB sb ) { return sb.p('"').p(_text).p('"'); }
  }
  public static final class Attribute extends Expr {
    public final Expr _base;
    public final String _field;
    Attribute( Expr base, String field ) { _base = base; _field = field; }
    @Override public SB str( SB sb ) { return _base.str(sb).p('.').p(_field); }
  }
  public static final class Record extends Expr {
    public final Map<String,Expr> _fields;
    Record( Map<String,Expr> fields ) { _fields = fields; }
    @Override public SB str( SB sb ) {
      sb.p('{');
      boolean first = true;
      for( Map.Entry<String,Expr> e : _fields.entrySet() ) {
        if( !first ) sb.p(", ");
        first = false;
        e.getValue().str(sb.p(e.getKey()).p(": "));
      }
      return sb.p('}');
    }
  }
  public static final class Call extends Expr {
    public final Target _callee;
    public final List<Expr> _args;
    public final int _line;
    Call( Target callee, List<Expr> args, int line ) { _callee = callee; _args = args; _line = line; }
    @Override public SB str( SB sb ) {
      sb.p(_callee.toString()).p('(');
      for( int i=0; i<_args.size(); i++ ) {
        if( i>0 ) sb.p(", ");
        _args.get(i).str(sb);
      }
      return sb.p(')');
    }
  }
}
