package com.acme.rmq.cli.service;

import com.acme.rmq.retrieval.pipeline.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Turns Ctrl+C into a graceful stop: the JVM shutdown hook cancels the run and then holds the JVM
 * open until the run has finished (acks sent, summary printed) or the grace period has elapsed.
 */
public class InterruptHandler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InterruptHandler.class);

    private final CancellationSignal signal;
    private final Duration gracePeriod;
    private final Runtime runtime;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;

    InterruptHandler(CancellationSignal signal, Duration gracePeriod, Runtime runtime) {
        this.signal = signal;
        this.gracePeriod = gracePeriod;
        this.runtime = runtime;
        this.hook = new Thread(this::handleShutdown, "rmq-shutdown");
    }

    public static InterruptHandler install(CancellationSignal signal, Duration gracePeriod) {
        InterruptHandler handler = new InterruptHandler(signal, gracePeriod, Runtime.getRuntime());
        handler.runtime.addShutdownHook(handler.hook);
        return handler;
    }

    void handleShutdown() {
        if (signal.cancel()) {
            logger.debug("Shutdown requested, stopping retrieval");
        }
        try {
            if (!finished.await(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Retrieval did not finish within {}s after interrupt, exiting", gracePeriod.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Releases a waiting shutdown hook and unregisters it. */
    @Override
    public void close() {
        finished.countDown();
        try {
            runtime.removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM is already shutting down, shutdown hook stays registered");
        }
    }
}
