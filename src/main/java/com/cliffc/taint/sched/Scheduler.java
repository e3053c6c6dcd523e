package com.cliffc.taint.sched;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/** A fixed pool of worker threads, shared by a whole analysis run.

    Work is handed out in buckets: {@link #map_reduce} splits its inputs into
    buckets, workers apply {@code map} to whole buckets, and the controller
    folds each bucket's result through {@code reduce} in bucket completion
    order.  That order is unspecified, so {@code reduce} must be commutative
    and associative for a deterministic answer.

    With parallelism disabled every call runs synchronously on the caller's
    thread: one {@code map} over all inputs, then one {@code reduce}.

    A failing bucket is logged and fatal: the pool is torn down and a
    {@link WorkerException} is thrown.  Nothing is retried.
 */
public class Scheduler {
  public static final int MAX_BUCKETS_PER_WORKER = 10;
  public static final int INPUTS_PER_BUCKET_STEP = 400;

  public final SchedulerConfig _config;
  final Logger _log;
  private ExecutorService _pool;        // Null if sequential or destroyed
  private boolean _destroyed;

  private Scheduler( SchedulerConfig config, Logger log ) {
    _config = config;
    _log = log;
    if( config._is_parallel ) {
      AtomicInteger ids = new AtomicInteger();
      _pool = Executors.newFixedThreadPool(config._number_of_workers, r -> {
          Thread t = new Thread(r,"taint-worker-"+ids.getAndIncrement());
          t.setDaemon(true);
          return t;
        });
    }
    _log.info("Created scheduler: {}", config);
  }
  public static Scheduler create( SchedulerConfig config ) { return create(config,LogManager.getLogger(Scheduler.class)); }
  public static Scheduler create( SchedulerConfig config, Logger log ) { return new Scheduler(config,log); }
  // Sequential scheduler, for tests
  public static Scheduler mock() { return create(SchedulerConfig.sequential()); }

  public boolean is_parallel() { return _config._is_parallel; }
  public int number_of_workers() { return _config._number_of_workers; }

  /** Bucket count when no bucket size is given: several small chunks per
   *  worker, more as the input grows, for load balancing. */
  public static int bucket_count( int workers, int inputs ) {
    return workers*Math.min(MAX_BUCKETS_PER_WORKER,1+inputs/INPUTS_PER_BUCKET_STEP);
  }

  /** Split inputs into contiguous buckets, of bucket_size each if positive,
   *  else into bucket_count() roughly equal buckets. */
  public <I> List<List<I>> buckets( List<I> inputs, int bucket_size ) {
    int n = inputs.size();
    ArrayList<List<I>> res = new ArrayList<>();
    if( n==0 ) return res;
    int size = bucket_size > 0 ? bucket_size : Math.max(1,(n+bucket_count(number_of_workers(),n)-1)/bucket_count(number_of_workers(),n));
    for( int i=0; i<n; i+=size )
      res.add(List.copyOf(inputs.subList(i,Math.min(n,i+size))));
    return res;
  }

  public <I,M,R> R map_reduce( R initial, Function<List<I>,M> map, BiFunction<M,R,R> reduce, List<I> inputs ) {
    return map_reduce(initial,map,reduce,inputs,_config._bucket_size);
  }

  public <I,M,R> R map_reduce( R initial, Function<List<I>,M> map, BiFunction<M,R,R> reduce, List<I> inputs, int bucket_size ) {
    check_alive();
    if( inputs.isEmpty() ) return initial;   // No bucket, in either mode
    if( !is_parallel() )
      return reduce.apply(map.apply(inputs),initial);
    List<List<I>> buckets = buckets(inputs,bucket_size);
    ExecutorCompletionService<M> ecs = new ExecutorCompletionService<>(_pool);
    for( List<I> bucket : buckets )
      ecs.submit(() -> run_bucket(map,bucket));
    R acc = initial;
    for( int done=0; done<buckets.size(); done++ ) {
      acc = reduce.apply(await(take(ecs)),acc);
      _log.trace("Processed {} of {} buckets", done+1, buckets.size());
    }
    return acc;
  }

  /** Side-effecting, resultless, order-insensitive work over all inputs. */
  public <I> void iter( Consumer<List<I>> f, List<I> inputs ) {
    map_reduce(null,(List<I> bucket) -> { f.accept(bucket); return null; },(Object ignore, Object acc) -> null,inputs);
  }

  /** Run one job on one worker, blocking until it is done. */
  public <R> R single_job( Supplier<R> job ) {
    check_alive();
    if( !is_parallel() ) return job.get();
    Future<R> f = _pool.submit(() -> run_bucket((List<Object> ignore) -> job.get(),List.of()));
    while( true ) {
      try {
        return f.get(_config._poll_millis,TimeUnit.MILLISECONDS);
      } catch( TimeoutException e ) {
        _log.trace("Waiting on single job");
      } catch( InterruptedException e ) {
        Thread.currentThread().interrupt();
        throw fail(new WorkerException("controller","interrupted waiting on single job",e));
      } catch( ExecutionException e ) {
        throw fail(unwrap(e));
      }
    }
  }

  /** Run f once on every worker, e.g. to set up worker-local state. */
  public void once_per_worker( Runnable f ) {
    check_alive();
    if( !is_parallel() ) { f.run(); return; }
    int n = number_of_workers();
    // Every task waits until all have started, so each holds its own thread
    CountDownLatch started = new CountDownLatch(n);
    ArrayList<Future<Object>> fs = new ArrayList<>();
    for( int i=0; i<n; i++ )
      fs.add(_pool.submit(() -> run_bucket((List<Object> ignore) -> {
            started.countDown();
            try { started.await(); }
            catch( InterruptedException e ) { Thread.currentThread().interrupt(); throw new IllegalStateException("interrupted",e); }
            f.run();
            return null;
          },List.of())));
    for( Future<Object> fut : fs ) await(fut);
  }

  /** Tear down the pool.  The scheduler is unusable afterwards. */
  public void destroy() {
    if( _destroyed ) return;
    _destroyed = true;
    if( _pool != null ) {
      _pool.shutdownNow();
      _pool = null;
    }
    _log.info("Destroyed scheduler: {}", _config);
  }

  // ----------------------------------------------------------
  // Runs on a worker; failures are tagged with the worker's name.
  private static <I,M> M run_bucket( Function<List<I>,M> map, List<I> bucket ) {
    try {
      return map.apply(bucket);
    } catch( RuntimeException | Error e ) {
      throw new WorkerException(Thread.currentThread().getName(),"failed on a bucket of "+bucket.size()+" inputs",e);
    }
  }

  private <M> Future<M> take( ExecutorCompletionService<M> ecs ) {
    try {
      return ecs.take();
    } catch( InterruptedException e ) {
      Thread.currentThread().interrupt();
      throw fail(new WorkerException("controller","interrupted waiting on workers",e));
    }
  }

  private <M> M await( Future<M> f ) {
    try {
      return f.get();
    } catch( InterruptedException e ) {
      Thread.currentThread().interrupt();
      throw fail(new WorkerException("controller","interrupted waiting on workers",e));
    } catch( ExecutionException e ) {
      throw fail(unwrap(e));
    }
  }

  private static WorkerException unwrap( ExecutionException e ) {
    return e.getCause() instanceof WorkerException we ? we : new WorkerException("unknown","worker failed",e.getCause());
  }

  // A failed worker is fatal for the whole pool
  private WorkerException fail( WorkerException e ) {
    _log.error("Worker failure, aborting: {}", e.getMessage(), e.getCause());
    destroy();
    return e;
  }

  private void check_alive() {
    if( _destroyed ) throw new IllegalStateException("Scheduler already destroyed");
  }
}
