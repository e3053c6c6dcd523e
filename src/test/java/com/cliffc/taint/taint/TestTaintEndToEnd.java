package com.cliffc.taint.taint;

import com.cliffc.taint.fixpoint.FixpointState;
import com.cliffc.taint.fixpoint.Target;
import com.cliffc.taint.ir.Define;
import com.cliffc.taint.ir.Program;
import com.cliffc.taint.sched.Scheduler;
import com.cliffc.taint.sched.SchedulerConfig;
import org.junit.After;
import org.junit.Test;

import java.util.List;

import static com.cliffc.taint.ir.Expr.*;
import static com.cliffc.taint.ir.Stmt.*;
import static com.cliffc.taint.taint.ModelBuilder.Declaration.*;
import static org.junit.Assert.*;

// Flows into callables without a body.
//
//   def obscure(arg): ...                 # no model at all
//   def source(): ...                     # returns Test
//   def _test_sink(x): ...                # x is a Test sink
//   def to_obscure(x):     obscure(x)
//   def direct_issue():    obscure(source())
//   def indirect_issue():  to_obscure(source())
//   def non_issue(x):      _test_sink(x)
public class TestTaintEndToEnd {
  private static Target f( String name ) { return Target.function(name); }
  private static final Target OBSCURE = f("obscure"), SOURCE = f("source"), TEST_SINK = f("_test_sink");
  private static final Target TO_OBSCURE = f("to_obscure"), DIRECT = f("direct_issue"), INDIRECT = f("indirect_issue"), NON_ISSUE = f("non_issue");

  private static Program program() {
    return new Program()
      .add(Define.stub(OBSCURE,"arg"))
      .add(Define.stub(SOURCE))
      .add(Define.stub(TEST_SINK,"x"))
      .add(Define.define(TO_OBSCURE,List.of("x"),eval(call(2,OBSCURE,param("x")))))
      .add(Define.define(DIRECT,List.of(),eval(call(5,OBSCURE,call(5,SOURCE)))))
      .add(Define.define(INDIRECT,List.of(),eval(call(8,TO_OBSCURE,call(8,SOURCE)))))
      .add(Define.define(NON_ISSUE,List.of("x"),eval(call(11,TEST_SINK,param("x")))));
  }
  private static final List<ModelBuilder.Declaration> DECLS = List.of(source(SOURCE,"Test"),sink(TEST_SINK,"x","Test"));
  private static final TaintConfig CONFIG = TaintConfig.test_config().with_find_obscure_flows(true);

  private Scheduler _sched;
  @After public void destroy() { if( _sched != null ) _sched.destroy(); }

  private static void check_obscure_issue( List<Issue> is, Target callee, int line ) {
    assertEquals(1,is.size());
    Issue i = is.get(0);
    assertEquals(TaintConfig.OBSCURE_FLOW_CODE,i.code());
    assertEquals("Obscure flow",i.name());
    assertEquals(callee,i._callee);
    assertEquals(line,i._line);
    assertEquals("Data from [Test] source(s) may reach an obscure model",i.message());
  }

  @Test public void testObscureFlows() {
    TaintRun r = TaintRun.run(CONFIG,Scheduler.mock(),program(),DECLS);
    assertEquals(FixpointState.Status.CONVERGED,r._state.status());
    // indirect_issue sees to_obscure's new sink one iteration later
    assertEquals(2,r._state.get_iterations());
    check_obscure_issue(r.issues(DIRECT),OBSCURE,5);
    check_obscure_issue(r.issues(INDIRECT),TO_OBSCURE,8);
    assertTrue(r.issues(NON_ISSUE).isEmpty());
    assertTrue(r.issues(TO_OBSCURE).isEmpty());
    assertEquals(2,r.issues().size());
    assertEquals(DIRECT,r.issues().get(0)._callable);

    TaintDomains d = r._domains;
    assertTrue(r.model(OBSCURE).is_obscure());
    assertEquals(java.util.Set.of(Kind.OBSCURE),d.kinds(d.TREE.collapse(d.SINKS.get(r.model(TO_OBSCURE)._sinks,"x"))));
    assertEquals(java.util.Set.of(Kind.named("Test")),d.kinds(d.TREE.collapse(d.SINKS.get(r.model(NON_ISSUE)._sinks,"x"))));
    assertFalse(r.model(TO_OBSCURE).is_obscure());
  }

  @Test public void testParallelRunAgrees() {
    _sched = Scheduler.create(SchedulerConfig.parallel(3).with_bucket_size(1));
    TaintRun r = TaintRun.run(CONFIG,_sched,program(),DECLS);
    assertEquals(2,r._state.get_iterations());
    assertEquals(TaintRun.run(CONFIG,Scheduler.mock(),program(),DECLS).issues(),r.issues());
  }

  // One iteration finds only the direct flow
  @Test public void testCappedRun() {
    TaintRun r = TaintRun.run(CONFIG.with_max_iterations(1),Scheduler.mock(),program(),DECLS);
    assertEquals(FixpointState.Status.CAPPED,r._state.status());
    assertEquals(1,r._state.get_iterations());
    check_obscure_issue(r.issues(DIRECT),OBSCURE,5);
    assertTrue(r.issues(INDIRECT).isEmpty());
  }

  // Without obscure-flow reporting, obscure callees only pass taint through
  @Test public void testObscureFlowsOff() {
    TaintRun r = TaintRun.run(TaintConfig.test_config(),Scheduler.mock(),program(),DECLS);
    assertTrue(r.issues().isEmpty());
    assertTrue(r.model(OBSCURE).is_obscure());
    assertTrue(r.model(OBSCURE)._sinks.isEmpty());
    assertTrue(r.model(TO_OBSCURE)._sinks.isEmpty());
  }

  // The obscure result carries the argument's taint
  @Test public void testObscurePropagates() {
    Target main = f("main");
    Program p = program().add(Define.define(main,List.of(),eval(call(21,TEST_SINK,call(20,OBSCURE,call(20,SOURCE))))));
    TaintRun r = TaintRun.run(TaintConfig.test_config(),Scheduler.mock(),p,DECLS);
    List<Issue> is = r.issues(main);
    assertEquals(1,is.size());
    assertEquals(5002,is.get(0).code());
    assertEquals(21,is.get(0)._line);
  }
}
