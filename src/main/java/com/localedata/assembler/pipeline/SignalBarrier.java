package com.localedata.assembler.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * Barrier released by the host once every unit of the build has been handed to the rewriter.
 */
public class SignalBarrier implements CompletionBarrier {

    private final CompletableFuture<Void> allUnitsEnumerated = new CompletableFuture<>();

    public void signalAllUnitsEnumerated() {
        allUnitsEnumerated.complete(null);
    }

    public boolean isSignalled() {
        return allUnitsEnumerated.isDone();
    }

    @Override
    public CompletableFuture<Void> whenReady() {
        return allUnitsEnumerated;
    }
}
