package com.cliffc.taint.taint;

import com.cliffc.taint.fixpoint.Target;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** A reported source-to-sink flow at one call site. */
public final class Issue implements Comparable<Issue> {
  public final Rule _rule;
  public final Target _callable;
  public final Target _callee;  // The call where the flow reaches the sink
  public final int _line;
  public final Set<Kind> _sources;
  public final Set<Kind> _sinks;

  Issue( Rule rule, Target callable, Target callee, int line, Set<Kind> sources, Set<Kind> sinks ) {
    _rule = rule;
    _callable = callable;
    _callee = callee;
    _line = line;
    _sources = Collections.unmodifiableSet(new TreeSet<>(sources));
    _sinks = Collections.unmodifiableSet(new TreeSet<>(sinks));
  }

  public int code() { return _rule._code; }
  public String name() { return _rule._name; }
  public String message() { return _rule.message(_sources,_sinks); }

  // Two matches of one rule at one call site are one issue
  String handle() { return _rule._code+":"+_line+":"+_callee; }
  Issue join( Issue that ) {
    assert handle().equals(that.handle());
    TreeSet<Kind> srcs = new TreeSet<>(_sources);  srcs.addAll(that._sources);
    TreeSet<Kind> snks = new TreeSet<>(_sinks  );  snks.addAll(that._sinks  );
    return new Issue(_rule,_callable,_callee,_line,srcs,snks);
  }

  @Override public int compareTo( Issue i ) {
    int c = Integer.compare(_line,i._line);
    if( c==0 ) c = Integer.compare(code(),i.code());
    return c!=0 ? c : _callee.compareTo(i._callee);
  }
  @Override public boolean equals( Object o ) {
    return o instanceof Issue i && _rule._code==i._rule._code && _callable.equals(i._callable) && _callee.equals(i._callee) &&
      _line==i._line && _sources.equals(i._sources) && _sinks.equals(i._sinks);
  }
  @Override public int hashCode() { return (handle().hashCode()*31+_sources.hashCode())*31+_sinks.hashCode(); }
  @Override public String toString() { return _callable+":"+_line+" "+code()+" "+name()+": "+message(); }
}
