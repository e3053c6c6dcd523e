package com.cliffc.taint.taint;

import com.cliffc.taint.domain.TreeDomain;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/** Source and sink kinds, rules and the precision limits of one run.
 *  Immutable; the with_ methods copy. */
public final class TaintConfig {
  public static final int OBSCURE_FLOW_CODE = 9001;
  public static final String RESOURCE = "taintfix.properties";

  public final Set<Kind> _sources;
  public final Set<Kind> _sinks;
  public final List<Rule> _rules;
  public final boolean _find_obscure_flows;
  public final int _max_tree_depth_after_widening;
  public final int _max_return_access_path_length;
  public final int _max_return_access_path_width;
  public final int _max_iterations;
  public final TreeDomain.WidenPolicy _widen_policy;

  private TaintConfig( Set<Kind> sources, Set<Kind> sinks, List<Rule> rules, boolean find_obscure_flows,
                       int max_tree_depth, int max_rap_length, int max_rap_width, int max_iterations, TreeDomain.WidenPolicy policy ) {
    if( max_tree_depth < 0 || max_rap_length < 0 || max_rap_width < 1 || max_iterations < 1 )
      throw new IllegalArgumentException("Bad taint limits: depth "+max_tree_depth+", path length "+max_rap_length+", path width "+max_rap_width+", iterations "+max_iterations);
    _sources = Set.copyOf(sources);
    _sinks = Set.copyOf(sinks);
    _rules = List.copyOf(rules);
    _find_obscure_flows = find_obscure_flows;
    _max_tree_depth_after_widening = max_tree_depth;
    _max_return_access_path_length = max_rap_length;
    _max_return_access_path_width = max_rap_width;
    _max_iterations = max_iterations;
    _widen_policy = policy;
    for( Rule r : _rules ) {
      for( Kind k : r._sources ) if( !_sources.contains(k) ) throw new IllegalArgumentException("Rule "+r+" uses unknown source "+k);
      for( Kind k : r._sinks   ) if( !_sinks  .contains(k) ) throw new IllegalArgumentException("Rule "+r+" uses unknown sink "+k);
    }
  }

  public static TaintConfig make( Set<String> sources, Set<String> sinks ) {
    return new TaintConfig(kinds(sources),kinds(sinks),List.of(),false,TreeDomain.DEFAULT_MAX_TREE_DEPTH,4,10,100,TreeDomain.WidenPolicy.WIDEN_ONLY);
  }
  // Test sources and sinks, with a rule between them
  public static TaintConfig test_config() {
    return make(Set.of("Test","UserControlled"),Set.of("Test","RemoteCodeExecution"))
      .with_rule(new Rule(5001,"Possible shell injection",kinds(Set.of("UserControlled")),kinds(Set.of("RemoteCodeExecution")),
                          "Data from [{$sources}] source(s) may reach [{$sinks}] sink(s)"))
      .with_rule(new Rule(5002,"Test flow",kinds(Set.of("Test")),kinds(Set.of("Test")),
                          "Data from [{$sources}] source(s) may reach [{$sinks}] sink(s)"));
  }

  public TaintConfig with_rule( Rule r ) {
    ArrayList<Rule> rs = new ArrayList<>(_rules);
    rs.add(r);
    return new TaintConfig(_sources,_sinks,rs,_find_obscure_flows,_max_tree_depth_after_widening,_max_return_access_path_length,_max_return_access_path_width,_max_iterations,_widen_policy);
  }
  public TaintConfig with_find_obscure_flows( boolean b ) {
    return new TaintConfig(_sources,_sinks,_rules,b,_max_tree_depth_after_widening,_max_return_access_path_length,_max_return_access_path_width,_max_iterations,_widen_policy);
  }
  public TaintConfig with_max_tree_depth_after_widening( int d ) {
    return new TaintConfig(_sources,_sinks,_rules,_find_obscure_flows,d,_max_return_access_path_length,_max_return_access_path_width,_max_iterations,_widen_policy);
  }
  public TaintConfig with_max_return_access_path( int length, int width ) {
    return new TaintConfig(_sources,_sinks,_rules,_find_obscure_flows,_max_tree_depth_after_widening,length,width,_max_iterations,_widen_policy);
  }
  public TaintConfig with_widen_policy( TreeDomain.WidenPolicy policy ) {
    return new TaintConfig(_sources,_sinks,_rules,_find_obscure_flows,_max_tree_depth_after_widening,_max_return_access_path_length,_max_return_access_path_width,_max_iterations,policy);
  }
  public TaintConfig with_max_iterations( int n ) {
    return new TaintConfig(_sources,_sinks,_rules,_find_obscure_flows,_max_tree_depth_after_widening,_max_return_access_path_length,_max_return_access_path_width,n,_widen_policy);
  }

  /** Rules checked at every call site: the configured ones, plus the
   *  obscure-flow rule from any source when looking for obscure flows. */
  public List<Rule> active_rules() {
    if( !_find_obscure_flows ) return _rules;
    ArrayList<Rule> rs = new ArrayList<>(_rules);
    rs.add(new Rule(OBSCURE_FLOW_CODE,"Obscure flow",_sources,Set.of(Kind.OBSCURE),
                    "Data from [{$sources}] source(s) may reach an obscure model"));
    return rs;
  }
  public boolean is_source( Kind k ) { return _sources.contains(k); }
  public boolean is_sink( Kind k ) { return _sinks.contains(k) || (k==Kind.OBSCURE && _find_obscure_flows); }

  // ----------------------------------------------------------
  /** Read the configuration from properties:
   *  <pre>
   *  taint.sources = Test, UserControlled
   *  taint.sinks = Test
   *  taint.find_obscure_flows = true
   *  taint.max_tree_depth_after_widening = 4
   *  taint.max_return_access_path_length = 4
   *  taint.max_return_access_path_width = 10
   *  taint.max_iterations = 100
   *  taint.widen_policy = WIDEN_ONLY
   *  taint.rule.5002.name = Test flow
   *  taint.rule.5002.sources = Test
   *  taint.rule.5002.sinks = Test
   *  taint.rule.5002.message = Data from [{$sources}] source(s) may reach [{$sinks}] sink(s)
   *  </pre>
   *  Missing limits take their defaults. */
  public static TaintConfig load( Properties props ) {
    TaintConfig c = new TaintConfig(kinds(list(props,"taint.sources")),kinds(list(props,"taint.sinks")),List.of(),
                                    Boolean.parseBoolean(props.getProperty("taint.find_obscure_flows","false")),
                                    integer(props,"taint.max_tree_depth_after_widening",TreeDomain.DEFAULT_MAX_TREE_DEPTH),
                                    integer(props,"taint.max_return_access_path_length",4),
                                    integer(props,"taint.max_return_access_path_width",10),
                                    integer(props,"taint.max_iterations",100),
                                    policy(props.getProperty("taint.widen_policy","WIDEN_ONLY").trim()));
    TreeSet<Integer> codes = new TreeSet<>();
    for( String key : props.stringPropertyNames() ) {
      if( !key.startsWith("taint.rule.") ) continue;
      String[] parts = key.split("\\.");
      if( parts.length != 4 ) throw new IllegalArgumentException("Bad rule key: "+key);
      codes.add(integer(key,parts[2]));
    }
    for( int code : codes ) {
      String pre = "taint.rule."+code+".";
      c = c.with_rule(new Rule(code,
                               required(props,pre+"name"),
                               kinds(list(props,pre+"sources")),
                               kinds(list(props,pre+"sinks")),
                               props.getProperty(pre+"message","Data from [{$sources}] source(s) may reach [{$sinks}] sink(s)")));
    }
    return c;
  }

  /** The configuration shipped on the classpath. */
  public static TaintConfig load() {
    try( InputStream in = TaintConfig.class.getClassLoader().getResourceAsStream(RESOURCE) ) {
      if( in==null ) throw new IllegalStateException("Missing resource "+RESOURCE);
      Properties props = new Properties();
      props.load(in);
      return load(props);
    } catch( IOException e ) {
      throw new UncheckedIOException("Reading "+RESOURCE,e);
    }
  }

  private static TreeDomain.WidenPolicy policy( String s ) {
    try {
      return TreeDomain.WidenPolicy.valueOf(s);
    } catch( IllegalArgumentException e ) {
      throw new IllegalArgumentException("Unknown widen policy: "+s,e);
    }
  }
  private static Set<Kind> kinds( Collection<String> names ) {
    TreeSet<Kind> ks = new TreeSet<>();
    for( String n : names ) ks.add(Kind.named(n));
    return ks;
  }
  private static List<String> list( Properties props, String key ) {
    ArrayList<String> res = new ArrayList<>();
    for( String s : required(props,key).split(",") )
      if( !s.isBlank() ) res.add(s.trim());
    return res;
  }
  private static String required( Properties props, String key ) {
    String s = props.getProperty(key);
    if( s==null ) throw new IllegalArgumentException("Missing property "+key);
    return s.trim();
  }
  private static int integer( Properties props, String key, int dflt ) {
    String s = props.getProperty(key);
    return s==null ? dflt : integer(key,s.trim());
  }
  private static int integer( String key, String s ) {
    try {
      return Integer.parseInt(s);
    } catch( NumberFormatException e ) {
      throw new IllegalArgumentException("Property "+key+" is not a number: "+s,e);
    }
  }

  @Override public String toString() {
    return "TaintConfig(sources="+new TreeSet<>(_sources)+", sinks="+new TreeSet<>(_sinks)+", rules="+_rules+
      ", find_obscure_flows="+_find_obscure_flows+", depth="+_max_tree_depth_after_widening+
      ", path="+_max_return_access_path_length+"x"+_max_return_access_path_width+", iterations="+_max_iterations+", "+_widen_policy+")";
  }
}
