package com.janitor.dispatch;

import com.janitor.context.RunCache;
import com.janitor.lifecycle.LifecycleEngine;
import com.janitor.lifecycle.LifecycleOutcome;
import com.janitor.model.KubeResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.function.BooleanSupplier;

/**
 * Fans the resources of one run out to a fixed pool of workers.
 * <p>
 * The coordinator thread {@link #submit submits} resources into a bounded queue (blocking when
 * full); each worker skips identities already in the {@link DedupSet}, runs the
 * {@link LifecycleEngine} and merges the resulting counter increments. A failure for one
 * resource is logged and the worker moves on. {@link #awaitCompletion()} is the barrier: it
 * returns once every worker has drained the queue.
 * <p>
 * Once cancellation is observed, queued resources are discarded without being evaluated;
 * decisions already in flight complete.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private static final String THREAD_NAME_PREFIX = "janitor-worker-";

    private final LifecycleEngine engine;
    private final RunCache cache;
    private final Counters counters;
    private final DedupSet dedupSet;
    private final BooleanSupplier cancelled;
    private final BlockingQueue<DispatchWorker.WorkItem> queue;
    private final List<DispatchWorker> workers;

    private boolean started;
    private boolean completed;

    public Dispatcher(LifecycleEngine engine,
                      int parallelism,
                      int queueCapacity,
                      RunCache cache,
                      Counters counters,
                      DedupSet dedupSet,
                      BooleanSupplier cancelled) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.engine = engine;
        this.cache = cache;
        this.counters = counters;
        this.dedupSet = dedupSet;
        this.cancelled = cancelled;
        // room for one end-of-work marker per worker beyond the configured capacity
        this.queue = new ArrayBlockingQueue<>(queueCapacity + parallelism);
        this.workers = new ArrayList<>(parallelism);
        for (int i = 0; i < parallelism; i++) {
            workers.add(new DispatchWorker(i + 1, THREAD_NAME_PREFIX, queue, this::handle, log));
        }
    }

    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Dispatcher already started");
        }
        started = true;
        workers.forEach(Thread::start);
        log.debug("Started {} workers", workers.size());
    }

    /**
     * Queue a resource, blocking while the queue is full.
     *
     * @return false if the resource was not queued because the run is cancelled
     */
    public boolean submit(KubeResource resource) throws InterruptedException {
        if (!started || completed) {
            throw new IllegalStateException("Dispatcher is not accepting work");
        }
        if (cancelled.getAsBoolean()) {
            return false;
        }
        queue.put(new DispatchWorker.WorkItem(resource));
        return true;
    }

    /**
     * Signal end of work and wait for all workers to finish.
     */
    public void awaitCompletion() throws InterruptedException {
        synchronized (this) {
            if (!started || completed) {
                return;
            }
            completed = true;
        }
        for (int i = 0; i < workers.size(); i++) {
            queue.put(DispatchWorker.WorkItem.END_OF_WORK);
        }
        for (DispatchWorker worker : workers) {
            worker.join();
        }
        log.debug("All workers finished");
    }

    void handle(KubeResource resource) {
        if (cancelled.getAsBoolean()) {
            log.debug("Run cancelled, skipping {}", resource);
            return;
        }

        if (!dedupSet.markSeen(resource.getIdentity())) {
            log.debug("Skipping already processed resource: {}", resource.getIdentity());
            return;
        }

        counters.increment(Counters.RESOURCES_PROCESSED);
        LifecycleOutcome outcome = engine.process(resource, cache);
        outcome.increments().forEach(counters::increment);
    }
}
