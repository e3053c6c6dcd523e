package com.cliffc.taint.taint;

import com.cliffc.taint.util.SB;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/** A source-to-sink flow worth reporting.  The message format may mention
 *  {@code {$sources}} and {@code {$sinks}}, replaced by the matched kinds. */
public final class Rule {
  public final int _code;
  public final String _name;
  public final Set<Kind> _sources;
  public final Set<Kind> _sinks;
  public final String _message_format;

  public Rule( int code, String name, Set<Kind> sources, Set<Kind> sinks, String message_format ) {
    if( sources.isEmpty() || sinks.isEmpty() ) throw new IllegalArgumentException("Rule "+code+" needs sources and sinks");
    _code = code;
    _name = name;
    _sources = Set.copyOf(sources);
    _sinks = Set.copyOf(sinks);
    _message_format = message_format;
  }

  public String message( Collection<Kind> sources, Collection<Kind> sinks ) {
    return _message_format
      .replace("{$sources}",join(sources))
      .replace("{$sinks}",join(sinks));
  }
  private static String join( Collection<Kind> ks ) { return new SB().p(new TreeSet<>(ks),", ").toString(); }

  @Override public String toString() { return _code+" "+_name; }
}
