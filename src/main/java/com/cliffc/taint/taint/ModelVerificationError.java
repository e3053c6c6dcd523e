package com.cliffc.taint.taint;

import com.cliffc.taint.fixpoint.Target;

/** A user declaration that could not be turned into a model.  Not thrown:
 *  the declaration is skipped and the error reported. */
public final class ModelVerificationError {
  public enum Tag { UNKNOWN_CALLABLE, UNKNOWN_PARAMETER, UNKNOWN_SOURCE, UNKNOWN_SINK }
  public final Tag _tag;
  public final Target _callable;
  public final String _detail;

  ModelVerificationError( Tag tag, Target callable, String detail ) { _tag = tag; _callable = callable; _detail = detail; }

  @Override public String toString() {
    return switch( _tag ) {
    case UNKNOWN_CALLABLE  -> "Model for unknown callable "+_callable;
    case UNKNOWN_PARAMETER -> "Model for "+_callable+" names unknown parameter "+_detail;
    case UNKNOWN_SOURCE    -> "Model for "+_callable+" uses unknown source kind "+_detail;
    case UNKNOWN_SINK      -> "Model for "+_callable+" uses unknown sink kind "+_detail;
    };
  }
}
