package com.localedata.assembler.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * Point a trigger unit waits at before the request set is considered complete.
 */
public interface CompletionBarrier {

    /**
     * Completes once planning may start. Each call may return a new future.
     */
    CompletableFuture<Void> whenReady();
}
