package com.taskpool.core;

import org.slf4j.Logger;

/**
 * Persistent worker thread running the pool's unbound dispatch loop until shutdown.
 */
final class WorkerThread extends Thread {

    private final int workerId;
    private final DefaultWorkerPool pool;
    private final Logger log;

    WorkerThread(int workerId, String name, boolean daemon, DefaultWorkerPool pool, Logger log) {
        super(name);
        this.workerId = workerId;
        this.pool = pool;
        this.log = log;
        setDaemon(daemon);
        setUncaughtExceptionHandler((thread, e) ->
                log.error("Worker {} terminated by {}", workerId, e.toString(), e));
    }

    @Override
    public void run() {
        log.debug("Worker {} started", workerId);
        pool.dispatch(null);
        log.debug("Worker {} stopped", workerId);
    }

    int getWorkerId() {
        return workerId;
    }
}
