package com.wasteland.util;

import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small pool dedicated to network I/O (settlement calls).
 * Callers bound their wait on the returned future so a slow remote never stalls a request.
 */
@Slf4j
@Singleton
public class IoExecutor {

    private static final int POOL_SIZE = 4;

    private final ExecutorService executor;

    public IoExecutor() {
        this(POOL_SIZE);
    }

    public IoExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "Wasteland-IO-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(threads, tf);
        log.info("IoExecutor initialized with {} threads", threads);
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    /**
     * Debug helper: current queued task count.
     */
    public int getQueueSize() {
        if (executor instanceof ThreadPoolExecutor tpe) {
            return tpe.getQueue().size();
        }
        return 0;
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
