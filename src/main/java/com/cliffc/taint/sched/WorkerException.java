package com.cliffc.taint.sched;

/** A unit of work failed inside the pool.  Fatal for the whole run: work is
 *  never retried or resubmitted. */
public class WorkerException extends RuntimeException {
  public final String _worker;
  public WorkerException( String worker, String msg, Throwable cause ) {
    super(worker+": "+msg,cause);
    _worker = worker;
  }
}
