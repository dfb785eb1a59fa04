package com.janitor.dispatch;

import com.janitor.model.KubeResource;
import org.slf4j.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

/**
 * Worker thread that takes resources from the dispatcher queue until it receives the
 * end-of-work marker.
 */
final class DispatchWorker extends Thread {

    private final int workerId;
    private final BlockingQueue<WorkItem> queue;
    private final Consumer<KubeResource> handler;
    private final Logger log;

    DispatchWorker(int workerId,
                   String threadNamePrefix,
                   BlockingQueue<WorkItem> queue,
                   Consumer<KubeResource> handler,
                   Logger log) {
        super(threadNamePrefix + workerId);
        this.workerId = workerId;
        this.queue = queue;
        this.handler = handler;
        this.log = log;
        setDaemon(false);
    }

    @Override
    public void run() {
        log.debug("Worker {} started", workerId);

        while (true) {
            WorkItem item;
            try {
                item = queue.take();
            } catch (InterruptedException e) {
                log.debug("Worker {} interrupted", workerId);
                Thread.currentThread().interrupt();
                break;
            }

            if (item.isEndOfWork()) {
                break;
            }

            try {
                handler.accept(item.resource());
            } catch (RuntimeException e) {
                log.error("Worker {}: error handling {}: {}", workerId, item.resource(), e.getMessage(), e);
            }
        }

        log.debug("Worker {} finished", workerId);
    }

    /**
     * Queue entry; a null resource marks the end of work.
     */
    record WorkItem(KubeResource resource) {

        static final WorkItem END_OF_WORK = new WorkItem(null);

        boolean isEndOfWork() {
            return resource == null;
        }
    }
}
