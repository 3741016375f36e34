package com.marketdata.pipeline;

/**
 * Spacing between consecutive symbols of one run.
 */
public interface PacingPolicy {

    /**
     * Blocks until the next symbol may be fetched.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void awaitNextSymbol() throws InterruptedException;
}
