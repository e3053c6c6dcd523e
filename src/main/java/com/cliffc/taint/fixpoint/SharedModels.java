package com.cliffc.taint.fixpoint;

import org.jctools.maps.NonBlockingHashMap;

import java.util.Map;
import java.util.Set;

/** The model table shared by all workers.

    Two generations: committed models, read by every worker during an
    iteration, and pending models, written by workers.  Each worker writes
    only the models of the callables in its own bucket, so a key has at most
    one writer per generation.  The driver commits pending models between
    iterations, when no worker runs.
 */
public final class SharedModels<M> {
  private final NonBlockingHashMap<Target,M> _committed = new NonBlockingHashMap<>();
  private final NonBlockingHashMap<Target,M> _pending = new NonBlockingHashMap<>();

  public M get( Target t ) { return _committed.get(t); }
  public boolean contains( Target t ) { return _committed.containsKey(t); }
  public Set<Target> targets() { return _committed.keySet(); }
  public int size() { return _committed.size(); }

  // Initial models, recorded before the fixpoint starts
  public void add( Target t, M m ) { _committed.put(t,m); }

  void put_pending( Target t, M m ) {
    M old = _pending.putIfAbsent(t,m);
    assert old==null : "Two writers for "+t+" in one generation";
  }

  void commit() {
    for( Map.Entry<Target,M> e : _pending.entrySet() )
      _committed.put(e.getKey(),e.getValue());
    _pending.clear();
  }

  void clear() { _committed.clear(); _pending.clear(); }
}
