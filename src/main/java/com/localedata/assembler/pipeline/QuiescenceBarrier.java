package com.localedata.assembler.pipeline;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort barrier: each waiting trigger resumes after a fixed delay,
 * assuming concurrently scheduled units have recorded their requests by then.
 * Requests recorded later than the delay are missed.
 */
public class QuiescenceBarrier implements CompletionBarrier {

    private final Duration delay;

    public QuiescenceBarrier(Duration delay) {
        this.delay = delay;
    }

    @Override
    public CompletableFuture<Void> whenReady() {
        return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }
}
