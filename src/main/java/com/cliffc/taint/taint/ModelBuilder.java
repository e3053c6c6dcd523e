package com.cliffc.taint.taint;

import com.cliffc.taint.domain.Label;
import com.cliffc.taint.domain.Tree;
import com.cliffc.taint.fixpoint.Target;
import com.cliffc.taint.ir.Define;
import com.cliffc.taint.ir.Program;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/** Turns user declarations into initial models.

    A bad declaration (unknown callable, parameter or kind) becomes a
    {@link ModelVerificationError}, logged and skipped; the rest of the
    declarations still contribute.  A stub without any declaration gets an
    obscure model: its arguments may flow anywhere.
 */
public class ModelBuilder {

  /** One user-declared fact about a callable. */
  public static final class Declaration {
    public enum Tag { SOURCE, SINK, TITO, OBSCURE }
    public final Tag _tag;
    public final Target _callable;
    public final String _kind;          // Sources and sinks
    public final String _param;         // Sinks and tito
    public final List<Label> _path;

    private Declaration( Tag tag, Target callable, String kind, String param, List<Label> path ) {
      _tag = tag; _callable = callable; _kind = kind; _param = param; _path = path;
    }
    // Source on the return value, at path
    public static Declaration source( Target c, String kind, Label... path ) { return new Declaration(Tag.SOURCE,c,kind,null,Label.path(path)); }
    public static Declaration sink( Target c, String param, String kind, Label... path ) { return new Declaration(Tag.SINK,c,kind,param,Label.path(path)); }
    // The parameter at path flows to the return value
    public static Declaration tito( Target c, String param, Label... path ) { return new Declaration(Tag.TITO,c,null,param,Label.path(path)); }
    public static Declaration obscure( Target c ) { return new Declaration(Tag.OBSCURE,c,null,null,List.of()); }
    @Override public String toString() {
      return _tag+"("+_callable+(_param==null ? "" : ", "+_param)+(_kind==null ? "" : ", "+_kind)+Label.show_path(_path)+")";
    }
  }

  /** Models by callable, and the declarations that were skipped. */
  public static final class Result {
    public final Map<Target,Model> _models;
    public final List<ModelVerificationError> _errors;
    Result( Map<Target,Model> models, List<ModelVerificationError> errors ) { _models = models; _errors = errors; }
  }

  final TaintDomains _d;
  final Program _program;
  final Logger _log;

  public ModelBuilder( TaintDomains d, Program program ) { this(d,program,LogManager.getLogger(ModelBuilder.class)); }
  public ModelBuilder( TaintDomains d, Program program, Logger log ) { _d = d; _program = program; _log = log; }

  public Result build( List<Declaration> decls ) {
    LinkedHashMap<Target,Model> models = new LinkedHashMap<>();
    ArrayList<ModelVerificationError> errors = new ArrayList<>();
    for( Declaration decl : decls ) {
      ModelVerificationError err = verify(decl);
      if( err != null ) {
        _log.warn("Skipping {}: {}", decl, err);
        errors.add(err);
        continue;
      }
      Model m = models.getOrDefault(decl._callable,_d.MODEL.bottom());
      models.put(decl._callable,_d.MODEL.join(m,model(decl)));
    }
    for( Define d : _program.defines() )
      if( d.is_stub() && !models.containsKey(d._target) ) {
        _log.debug("No model for {}, treating it as obscure", d._target);
        models.put(d._target,model(Declaration.obscure(d._target)));
      }
    return new Result(models,errors);
  }

  private ModelVerificationError verify( Declaration decl ) {
    Define d = _program.contains(decl._callable) ? _program.define(decl._callable) : null;
    if( d==null )
      return new ModelVerificationError(ModelVerificationError.Tag.UNKNOWN_CALLABLE,decl._callable,null);
    if( decl._param != null && d.param_index(decl._param) < 0 )
      return new ModelVerificationError(ModelVerificationError.Tag.UNKNOWN_PARAMETER,decl._callable,decl._param);
    if( decl._tag==Declaration.Tag.SOURCE && !_d._config.is_source(Kind.named(decl._kind)) )
      return new ModelVerificationError(ModelVerificationError.Tag.UNKNOWN_SOURCE,decl._callable,decl._kind);
    if( decl._tag==Declaration.Tag.SINK && !_d._config._sinks.contains(Kind.named(decl._kind)) )
      return new ModelVerificationError(ModelVerificationError.Tag.UNKNOWN_SINK,decl._callable,decl._kind);
    return null;
  }

  private Model model( Declaration decl ) {
    Model m = _d.MODEL.bottom();
    switch( decl._tag ) {
    case SOURCE:
      return m.with_sources(_d.TREE.prepend(decl._path,_d.leaf(Kind.named(decl._kind),TraceInfo.DECLARATION)));
    case SINK:
      return m.with_sinks(_d.SINKS.singleton(decl._param,_d.TREE.prepend(decl._path,_d.leaf(Kind.named(decl._kind),TraceInfo.DECLARATION))));
    case TITO:
      return m.with_tito(_d.TITO.singleton(decl._param,_d.TREE.prepend(decl._path,_d.local_return(List.of()))));
    case OBSCURE: {
      m = m.with_modes(_d.MODES.singleton(Model.Mode.OBSCURE));
      if( !_d._config._find_obscure_flows ) return m;
      // Every argument may reach the obscure sink
      Map<String,Tree<Map<Kind,FlowDetails>>> sinks = _d.SINKS.bottom();
      for( String p : _program.define(decl._callable)._params )
        sinks = _d.SINKS.set(sinks,p,_d.leaf(Kind.OBSCURE,TraceInfo.DECLARATION));
      return m.with_sinks(sinks);
    }
    default: throw new IllegalStateException("Unknown declaration "+decl);
    }
  }
}
