package com.cliffc.taint.sched;

/** Worker pool settings.  Immutable; {@code with_*} returns a modified copy. */
public final class SchedulerConfig {
  public final boolean _is_parallel;
  public final int _number_of_workers;
  public final int _bucket_size;      // 0: derive the bucket count from the input size
  public final long _poll_millis;     // single_job readiness poll interval

  private SchedulerConfig( boolean is_parallel, int number_of_workers, int bucket_size, long poll_millis ) {
    if( number_of_workers < 1 ) throw new IllegalArgumentException("need at least one worker, got "+number_of_workers);
    if( bucket_size < 0 ) throw new IllegalArgumentException("negative bucket size "+bucket_size);
    _is_parallel = is_parallel;
    _number_of_workers = number_of_workers;
    _bucket_size = bucket_size;
    _poll_millis = poll_millis;
  }

  public static SchedulerConfig parallel( int workers ) { return new SchedulerConfig(true,workers,0,50); }
  public static SchedulerConfig parallel() { return parallel(Runtime.getRuntime().availableProcessors()); }
  public static SchedulerConfig sequential() { return new SchedulerConfig(false,1,0,50); }

  public SchedulerConfig with_bucket_size( int bucket_size ) { return new SchedulerConfig(_is_parallel,_number_of_workers,bucket_size,_poll_millis); }
  public SchedulerConfig with_poll_millis( long poll_millis ) { return new SchedulerConfig(_is_parallel,_number_of_workers,_bucket_size,poll_millis); }

  @Override public String toString() {
    return (_is_parallel ? "parallel("+_number_of_workers+")" : "sequential")+(_bucket_size>0 ? " bucket="+_bucket_size : "");
  }
}
