package com.phillippitts.tapguard.service.terminal;

import java.util.concurrent.CompletableFuture;

/**
 * Reader commands produced by the recovery engine.
 *
 * <p>All calls are asynchronous; the engine bounds how long it waits on each future.
 * Failures are signalled by completing the future exceptionally.
 */
public interface ReaderGateway {

    /**
     * Cancels any discovery in progress. Completes normally when nothing is running.
     */
    CompletableFuture<Void> cancelDiscovery();

    CompletableFuture<Void> clearDiscoveredReaders();

    /**
     * Starts discovery for the given device type. The returned future completes when
     * discovery stops (cancelled or finished); updates arrive through the listener.
     */
    CompletableFuture<Void> startDiscovery(String deviceTypeFilter, DiscoveryListener listener);

    CompletableFuture<Void> connect(String readerId);
}
