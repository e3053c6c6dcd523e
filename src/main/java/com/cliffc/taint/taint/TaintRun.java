package com.cliffc.taint.taint;

import com.cliffc.taint.fixpoint.DependencyGraph;
import com.cliffc.taint.fixpoint.Fixpoint;
import com.cliffc.taint.fixpoint.FixpointState;
import com.cliffc.taint.fixpoint.Target;
import com.cliffc.taint.ir.Define;
import com.cliffc.taint.ir.Program;
import com.cliffc.taint.sched.Scheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One whole analysis: declarations to initial models, then the fixpoint. */
public final class TaintRun {
  private static final Logger LOG = LogManager.getLogger(TaintRun.class);

  public final TaintDomains _domains;
  public final Program _program;
  public final List<ModelVerificationError> _model_errors;
  public final FixpointState<Model,List<Issue>> _state;

  private TaintRun( TaintDomains domains, Program program, List<ModelVerificationError> errors, FixpointState<Model,List<Issue>> state ) {
    _domains = domains; _program = program; _model_errors = errors; _state = state;
  }

  public static TaintRun run( TaintConfig config, Scheduler sched, Program program, List<ModelBuilder.Declaration> decls ) {
    TaintDomains d = new TaintDomains(config);
    ModelBuilder.Result initial = new ModelBuilder(d,program).build(decls);
    DependencyGraph graph = program.graph();
    TaintAnalysis analysis = new TaintAnalysis(d,program,initial._models);
    FixpointState<Model,List<Issue>> state = new Fixpoint<>(analysis).compute(sched,graph,initial._models,config._max_iterations);
    TaintRun run = new TaintRun(d,program,initial._errors,state);
    LOG.info("Taint analysis {} after {} iterations: {} issues, {} model errors, {} analysis errors",
             state.status(), state.get_iterations(), run.issues().size(), initial._errors.size(), state.get_errors().size());
    return run;
  }

  public Model model( Target t ) { return _state.get_model(t); }
  public List<Issue> issues( Target t ) { return _state.get_result(t); }

  /** Every issue, by callable then line. */
  public List<Issue> issues() {
    ArrayList<Issue> all = new ArrayList<>();
    for( Define d : _program.defines() )
      if( !d.is_stub() )
        all.addAll(_state.get_result(d._target));
    Collections.sort(all,(a,b) -> {
        int c = a._callable.compareTo(b._callable);
        return c!=0 ? c : a.compareTo(b);
      });
    return all;
  }
}
