package com.cliffc.taint.ir;

import com.cliffc.taint.fixpoint.DependencyGraph;
import com.cliffc.taint.fixpoint.Target;

import java.util.*;

/** All callables of one analysis run, plus the method override relation. */
public final class Program {
  private final LinkedHashMap<Target,Define> _defines = new LinkedHashMap<>();
  private final LinkedHashMap<Target,List<Target>> _overrides = new LinkedHashMap<>();

  public Program add( Define d ) {
    if( _defines.putIfAbsent(d._target,d) != null )
      throw new IllegalArgumentException("Callable defined twice: "+d._target);
    return this;
  }
  public Program add_override( Target base, Target overriding ) {
    _overrides.computeIfAbsent(base,k -> new ArrayList<>()).add(overriding);
    return this;
  }

  /** The define of a callable; an override target resolves to its base method. */
  public Define define( Target t ) { return _defines.get(t.corresponding_method()); }
  public Collection<Define> defines() { return _defines.values(); }
  public boolean contains( Target t ) { return _defines.containsKey(t); }

  /** Call and override edges of every callable with a body. */
  public DependencyGraph graph() {
    DependencyGraph.Builder b = DependencyGraph.builder();
    for( Define d : _defines.values() ) {
      if( d.is_stub() ) continue;
      b.add_callable(d._target);
      for( Stmt s : d._body )
        add_calls(b,d._target,s._expr);
    }
    for( Map.Entry<Target,List<Target>> e : _overrides.entrySet() )
      for( Target o : e.getValue() )
        b.add_override(e.getKey(),o);
    return b.build();
  }

  private static void add_calls( DependencyGraph.Builder b, Target caller, Expr e ) {
    if( e instanceof Expr.Call c ) {
      b.add_call(caller,c._callee);
      for( Expr a : c._args ) add_calls(b,caller,a);
    } else if( e instanceof Expr.Attribute a ) {
      add_calls(b,caller,a._base);
    } else if( e instanceof Expr.Record r ) {
      for( Expr f : r._fields.values() ) add_calls(b,caller,f);
    }
  }
}
