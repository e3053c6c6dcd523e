package com.cliffc.taint.taint;

import com.cliffc.taint.domain.Label;
import com.cliffc.taint.domain.Tree;
import com.cliffc.taint.fixpoint.FixpointState;
import com.cliffc.taint.fixpoint.Target;
import com.cliffc.taint.ir.Define;
import com.cliffc.taint.ir.Program;
import com.cliffc.taint.sched.Scheduler;
import org.junit.Test;

import java.util.*;

import static com.cliffc.taint.ir.Expr.*;
import static com.cliffc.taint.ir.Stmt.*;
import static com.cliffc.taint.taint.ModelBuilder.Declaration.*;
import static org.junit.Assert.*;

public class TestTaintAnalysis {
  private static Target f( String name ) { return Target.function(name); }
  private static final Target SOURCE = f("source"), SINK = f("sink");

  // source() returns Test data, sink(x) is a Test sink
  private static Program program( Define... defs ) {
    Program p = new Program().add(Define.stub(SOURCE)).add(Define.stub(SINK,"x"));
    for( Define d : defs ) p.add(d);
    return p;
  }
  private static final List<ModelBuilder.Declaration> DECLS = List.of(source(SOURCE,"Test"),sink(SINK,"x","Test"));

  private static TaintRun run( Program p ) { return TaintRun.run(TaintConfig.test_config(),Scheduler.mock(),p,DECLS); }

  private static Set<Kind> kinds( TaintDomains d, Tree<Map<Kind,FlowDetails>> t ) { return d.kinds(d.TREE.collapse(t)); }
  private static Set<TraceInfo> traces( TaintDomains d, Tree<Map<Kind,FlowDetails>> t ) {
    return d.TREE.fold(d.TREE_TRACES,(ts,acc) -> { acc.addAll(ts); return acc; },new TreeSet<TraceInfo>(),t);
  }

  @Test public void testDirectFlow() {
    TaintRun r = run(program(Define.define(f("main"),List.of(),eval(call(7,SINK,call(6,SOURCE))))));
    assertEquals(FixpointState.Status.CONVERGED,r._state.status());
    assertEquals(1,r._state.get_iterations());
    List<Issue> is = r.issues(f("main"));
    assertEquals(1,is.size());
    Issue i = is.get(0);
    assertEquals(5002,i.code());
    assertEquals("Test flow",i.name());
    assertEquals(SINK,i._callee);
    assertEquals(7,i._line);
    assertEquals("Data from [Test] source(s) may reach [Test] sink(s)",i.message());
    assertEquals(is,r.issues());
    assertTrue(r._model_errors.isEmpty());
  }

  // Literals and unrelated values carry no taint
  @Test public void testNoFlow() {
    TaintRun r = run(program(Define.define(f("main"),List.of(),
                                           assign("s",call(1,SOURCE)),
                                           eval(call(2,SINK,literal("safe"))),
                                           ret(local("s")))));
    assertTrue(r.issues().isEmpty());
    // The source is returned instead
    TaintDomains d = r._domains;
    assertEquals(Set.of(Kind.named("Test")),kinds(d,r.model(f("main"))._sources));
    assertEquals(Set.of(TraceInfo.call_site(SOURCE,"result",1)),traces(d,r.model(f("main"))._sources));
  }

  // A parameter reaching a sink becomes a sink of the callable
  @Test public void testSinkThroughParameter() {
    Target wrapper = f("wrapper");
    TaintRun r = run(program(Define.define(wrapper,List.of("y"),eval(call(3,SINK,param("y")))),
                             Define.define(f("main"),List.of(),eval(call(9,wrapper,call(8,SOURCE))))));
    TaintDomains d = r._domains;
    Tree<Map<Kind,FlowDetails>> sink = d.SINKS.get(r.model(wrapper)._sinks,"y");
    assertEquals(Set.of(Kind.named("Test")),kinds(d,sink));
    assertEquals(Set.of(TraceInfo.call_site(SINK,"x",3)),traces(d,sink));
    assertTrue(r.model(wrapper)._tito.isEmpty());
    // main needs wrapper's model from the first iteration
    assertEquals(2,r._state.get_iterations());
    List<Issue> is = r.issues();
    assertEquals(1,is.size());
    assertEquals(f("main"),is.get(0)._callable);
    assertEquals(wrapper,is.get(0)._callee);
    assertEquals(9,is.get(0)._line);
  }

  // Fields of a record, read back through attributes
  @Test public void testFieldSensitivity() {
    TaintRun r = run(program(Define.define(f("main"),List.of(),
                                           assign("r",record("bad",call(1,SOURCE),"good",literal("ok"))),
                                           eval(call(2,SINK,attr(local("r"),"good"))),
                                           eval(call(3,SINK,attr(local("r"),"bad"))))));
    List<Issue> is = r.issues();
    assertEquals(1,is.size());
    assertEquals(3,is.get(0)._line);
  }

  // Taint in, taint out: a parameter returned inside a record
  @Test public void testTitoThroughRecord() {
    Target wrap = f("wrap");
    TaintRun r = run(program(Define.define(wrap,List.of("x"),ret(record("a",param("x")))),
                             Define.define(f("main"),List.of(),ret(attr(call(5,wrap,call(4,SOURCE)),"a")))));
    TaintDomains d = r._domains;
    Tree<Map<Kind,FlowDetails>> tito = d.TITO.get(r.model(wrap)._tito,"x");
    assertEquals(Set.of(Kind.LOCAL_RETURN),kinds(d,tito));
    Set<ReturnAccessPath> raps = d.return_paths(d.TREE.collapse(tito));
    assertEquals("[ReturnAccessPath[a]]",raps.toString());
    assertTrue(r.model(wrap)._sinks.isEmpty());

    // The source comes back out of field a, marked as tito
    Map<Kind,FlowDetails> returned = d.TREE.collapse(r.model(f("main"))._sources);
    FlowDetails fd = d.TAINT.get(returned,Kind.named("Test"));
    assertTrue(fd._simple._over.contains(Feature.TITO));
    assertEquals(FixpointState.Status.CONVERGED,r._state.status());
    assertEquals(3,r._state.get_iterations());
  }

  // Tito then sink: the flow is found through the tito model
  @Test public void testTitoIntoSink() {
    Target id = f("id");
    TaintRun r = run(program(Define.define(id,List.of("v"),ret(param("v"))),
                             Define.define(f("main"),List.of(),eval(call(12,SINK,call(11,id,call(10,SOURCE)))))));
    List<Issue> is = r.issues();
    assertEquals(1,is.size());
    assertEquals(12,is.get(0)._line);
    assertEquals(SINK,is.get(0)._callee);
  }

  @Test public void testRuleMatching() {
    Target rce = f("rce");
    Target uc = f("user_input");
    Program p = program(Define.stub(rce,"cmd"),Define.stub(uc),
                        Define.define(f("main"),List.of(),
                                      eval(call(1,rce,call(1,uc))),      // 5001
                                      eval(call(2,rce,call(2,SOURCE))),  // Test into RCE: no rule
                                      eval(call(3,SINK,call(3,uc)))));   // UserControlled into Test: no rule
    List<ModelBuilder.Declaration> decls = new ArrayList<>(DECLS);
    decls.add(sink(rce,"cmd","RemoteCodeExecution"));
    decls.add(source(uc,"UserControlled"));
    TaintRun r = TaintRun.run(TaintConfig.test_config(),Scheduler.mock(),p,decls);
    List<Issue> is = r.issues();
    assertEquals(1,is.size());
    assertEquals(5001,is.get(0).code());
    assertEquals("Data from [UserControlled] source(s) may reach [RemoteCodeExecution] sink(s)",is.get(0).message());
  }

  // Two sources into one sink at one call are one issue
  @Test public void testIssuesMerge() {
    Target two = f("two");
    Program p = program(Define.stub(two,"a","b"),
                        Define.define(f("main"),List.of(),eval(call(4,two,call(4,SOURCE),call(4,SOURCE)))));
    List<ModelBuilder.Declaration> decls = new ArrayList<>(DECLS);
    decls.add(sink(two,"a","Test"));
    decls.add(sink(two,"b","Test"));
    TaintRun r = TaintRun.run(TaintConfig.test_config(),Scheduler.mock(),p,decls);
    assertEquals(1,r.issues().size());
  }

  @Test public void testStubIsNotAnalyzed() {
    Program p = program();
    TaintDomains d = new TaintDomains(TaintConfig.test_config());
    TaintAnalysis a = new TaintAnalysis(d,p,Map.of());
    assertThrows(IllegalStateException.class,() -> a.analyze(SINK,d.MODEL.bottom(),t -> d.MODEL.bottom()));
    assertSame(d.MODEL,a.model_domain());
    assertTrue(a.empty_result().isEmpty());
  }

  // Matches pair every sink path with the sources readable there
  @Test public void testSourceSinkMatches() {
    TaintDomains d = new TaintDomains(TaintConfig.test_config());
    TaintAnalysis a = new TaintAnalysis(d,program(),Map.of());
    Kind test = Kind.named("Test");
    Tree<Map<Kind,FlowDetails>> sources = d.TREE.prepend(Label.path("a"),d.leaf(test,TraceInfo.DECLARATION));
    Tree<Map<Kind,FlowDetails>> sink_a = d.TREE.prepend(Label.path("a"),d.leaf(test,TraceInfo.DECLARATION));
    Tree<Map<Kind,FlowDetails>> sink_b = d.TREE.prepend(Label.path("b"),d.leaf(test,TraceInfo.DECLARATION));
    assertEquals(1,a.generate_source_sink_matches(sources,sink_a).size());
    assertTrue(a.generate_source_sink_matches(sources,sink_b).isEmpty());
    // A sink on the whole value sees every field
    assertEquals(1,a.generate_source_sink_matches(sources,d.leaf(test,TraceInfo.DECLARATION)).size());
    assertTrue(a.generate_source_sink_matches(d.TREE.bottom(),sink_a).isEmpty());
  }
}
