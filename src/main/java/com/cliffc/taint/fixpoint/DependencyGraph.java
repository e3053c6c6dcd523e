package com.cliffc.taint.fixpoint;

import java.util.*;

/** Who must be re-analyzed when a callable's model changes.

    Built from call edges (caller to callee) and override edges (base method
    to overriding method).  A callee's dependencies are its callers; a
    method with overrides also feeds its override target, which joins the
    models of the method and all its overriders.

    The callables to analyze are ordered callees first, so a sequential pass
    sees most callee models before their callers.
 */
public final class DependencyGraph {
  private final Map<Target,List<Target>> _dependencies;
  private final Map<Target,List<Target>> _overrides;
  private final List<Target> _callables;

  private DependencyGraph( Map<Target,List<Target>> dependencies, Map<Target,List<Target>> overrides, List<Target> callables ) {
    _dependencies = dependencies;
    _overrides = overrides;
    _callables = callables;
  }

  /** Callables to re-analyze when t's model changes. */
  public List<Target> dependencies( Target t ) { return _dependencies.getOrDefault(t,List.of()); }
  /** Methods overriding base, in insertion order. */
  public List<Target> overrides_of( Target base ) { return _overrides.getOrDefault(base,List.of()); }
  /** Every analyzed callable and override target, callees first. */
  public List<Target> callables_to_analyze() { return _callables; }
  public Set<Target> override_targets() {
    TreeSet<Target> ts = new TreeSet<>();
    for( Target base : _overrides.keySet() ) ts.add(Target.override(base));
    return ts;
  }

  public static Builder builder() { return new Builder(); }

  public static final class Builder {
    private final LinkedHashSet<Target> _defined = new LinkedHashSet<>();
    private final LinkedHashMap<Target,LinkedHashSet<Target>> _callees = new LinkedHashMap<>();
    private final LinkedHashMap<Target,LinkedHashSet<Target>> _overrides = new LinkedHashMap<>();

    /** A callable with a body, to be analyzed. */
    public Builder add_callable( Target t ) {
      if( t.is_override() ) throw new IllegalArgumentException("Override targets are derived, not defined: "+t);
      _defined.add(t);
      return this;
    }
    public Builder add_call( Target caller, Target callee ) {
      _callees.computeIfAbsent(caller,k -> new LinkedHashSet<>()).add(callee);
      return this;
    }
    public Builder add_override( Target base, Target overriding ) {
      _overrides.computeIfAbsent(base,k -> new LinkedHashSet<>()).add(overriding);
      return this;
    }

    public DependencyGraph build() {
      // Reverse edges: callee -> callers, and everything an override target joins -> that target
      LinkedHashMap<Target,LinkedHashSet<Target>> deps = new LinkedHashMap<>();
      for( Map.Entry<Target,LinkedHashSet<Target>> e : _callees.entrySet() )
        for( Target callee : e.getValue() )
          deps.computeIfAbsent(callee,k -> new LinkedHashSet<>()).add(e.getKey());
      LinkedHashMap<Target,LinkedHashSet<Target>> edges = new LinkedHashMap<>(_callees);
      for( Map.Entry<Target,LinkedHashSet<Target>> e : _overrides.entrySet() ) {
        Target over = Target.override(e.getKey());
        LinkedHashSet<Target> joined = new LinkedHashSet<>();
        joined.add(e.getKey());
        joined.addAll(e.getValue());
        edges.put(over,joined);
        for( Target t : joined )
          deps.computeIfAbsent(t,k -> new LinkedHashSet<>()).add(over);
      }
      // Callees-first order over defined callables and override targets
      LinkedHashSet<Target> roots = new LinkedHashSet<>(_defined);
      for( Target base : _overrides.keySet() ) roots.add(Target.override(base));
      ArrayList<Target> order = new ArrayList<>();
      HashSet<Target> visited = new HashSet<>();
      for( Target t : roots ) postorder(t,edges,roots,visited,order);

      HashMap<Target,List<Target>> dmap = new HashMap<>();
      for( Map.Entry<Target,LinkedHashSet<Target>> e : deps.entrySet() ) dmap.put(e.getKey(),List.copyOf(e.getValue()));
      HashMap<Target,List<Target>> omap = new HashMap<>();
      for( Map.Entry<Target,LinkedHashSet<Target>> e : _overrides.entrySet() ) omap.put(e.getKey(),List.copyOf(e.getValue()));
      return new DependencyGraph(dmap,omap,List.copyOf(order));
    }

    // Iterative DFS, so deep call chains do not blow the stack
    private static void postorder( Target root, Map<Target,LinkedHashSet<Target>> edges, Set<Target> keep, Set<Target> visited, List<Target> order ) {
      if( !visited.add(root) ) return;
      ArrayDeque<Target> stack = new ArrayDeque<>();
      ArrayDeque<Iterator<Target>> iters = new ArrayDeque<>();
      stack.push(root);
      iters.push(edges.getOrDefault(root,new LinkedHashSet<>()).iterator());
      while( !stack.isEmpty() ) {
        Iterator<Target> it = iters.peek();
        if( it.hasNext() ) {
          Target next = it.next();
          if( visited.add(next) ) {
            stack.push(next);
            iters.push(edges.getOrDefault(next,new LinkedHashSet<>()).iterator());
          }
        } else {
          iters.pop();
          Target t = stack.pop();
          if( keep.contains(t) ) order.add(t);
        }
      }
    }
  }
}
