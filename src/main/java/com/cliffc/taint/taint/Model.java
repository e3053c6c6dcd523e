package com.cliffc.taint.taint;

import com.cliffc.taint.domain.Tree;

import java.util.Map;
import java.util.Set;

/** The summary of one callable.

    sources: taint of the return value, by access path.
    sinks: per parameter, the sinks the argument may reach.
    tito: per parameter, the parts of the return value the argument flows
    into, as {@link Kind#LOCAL_RETURN} taint with return access paths.
    modes: e.g. obscure, for callables without a body.
 */
public final class Model {
  public enum Mode { OBSCURE }

  public final Tree<Map<Kind,FlowDetails>> _sources;
  public final Map<String,Tree<Map<Kind,FlowDetails>>> _sinks;
  public final Map<String,Tree<Map<Kind,FlowDetails>>> _tito;
  public final Set<Mode> _modes;

  public Model( Tree<Map<Kind,FlowDetails>> sources, Map<String,Tree<Map<Kind,FlowDetails>>> sinks,
                Map<String,Tree<Map<Kind,FlowDetails>>> tito, Set<Mode> modes ) {
    _sources = sources; _sinks = sinks; _tito = tito; _modes = modes;
  }
  public Model with_sources( Tree<Map<Kind,FlowDetails>> t ) { return t==_sources ? this : new Model(t,_sinks,_tito,_modes); }
  public Model with_sinks( Map<String,Tree<Map<Kind,FlowDetails>>> m ) { return m==_sinks ? this : new Model(_sources,m,_tito,_modes); }
  public Model with_tito( Map<String,Tree<Map<Kind,FlowDetails>>> m ) { return m==_tito ? this : new Model(_sources,_sinks,m,_modes); }
  public Model with_modes( Set<Mode> s ) { return s==_modes ? this : new Model(_sources,_sinks,_tito,s); }

  public boolean is_obscure() { return _modes.contains(Mode.OBSCURE); }

  @Override public boolean equals( Object o ) {
    return o instanceof Model m && _sources.equals(m._sources) && _sinks.equals(m._sinks) && _tito.equals(m._tito) && _modes.equals(m._modes);
  }
  @Override public int hashCode() { return ((_sources.hashCode()*31+_sinks.hashCode())*31+_tito.hashCode())*31+_modes.hashCode(); }
}
