package com.wayfarer.security;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards the cold-start provisioning of the permission store.
 * <p>
 * The first caller of {@link #awaitReady()} installs a shared future and runs the
 * {@link PolicyBootstrap} itself; every caller arriving while that attempt is
 * in flight joins the same future. Success is sticky. On failure the slot is cleared
 * before the future completes exceptionally, so all current waiters see the same
 * {@link PolicyUnavailableException} and the next caller starts a fresh attempt.
 */
public final class PolicyInitializer {

    private static final Logger log = LoggerFactory.getLogger(PolicyInitializer.class);

    private final PolicyBootstrap bootstrap;
    private final AtomicReference<CompletableFuture<Void>> attempt = new AtomicReference<>();
    private volatile boolean ready;

    public PolicyInitializer(PolicyBootstrap bootstrap) {
        if (bootstrap == null) {
            throw new IllegalArgumentException("bootstrap must not be null");
        }
        this.bootstrap = bootstrap;
    }

    /** An initializer whose store needs no provisioning. */
    public static PolicyInitializer alreadyReady() {
        PolicyInitializer initializer = new PolicyInitializer(PolicyBootstrap.none());
        initializer.ready = true;
        return initializer;
    }

    /**
     * Blocks until the store is provisioned, running the bootstrap if nobody else is.
     *
     * @throws PolicyUnavailableException if the attempt this caller observed failed
     */
    public void awaitReady() {
        while (!ready) {
            CompletableFuture<Void> pending = attempt.get();
            if (pending == null) {
                CompletableFuture<Void> mine = new CompletableFuture<>();
                if (!attempt.compareAndSet(null, mine)) {
                    continue;
                }
                runBootstrap(mine);
                pending = mine;
            }
            join(pending);
            return;
        }
    }

    /** Whether provisioning has completed successfully. */
    public boolean isReady() {
        return ready;
    }

    private void runBootstrap(CompletableFuture<Void> mine) {
        log.info("Provisioning permission store");
        try {
            bootstrap.initialize();
            ready = true;
            mine.complete(null);
            log.info("Permission store ready");
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            attempt.compareAndSet(mine, null);
            log.error("Permission store provisioning failed; next request will retry", t);
            mine.completeExceptionally(t);
        }
    }

    private static void join(CompletableFuture<Void> pending) {
        try {
            pending.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PolicyUnavailableException unavailable) {
                throw unavailable;
            }
            throw new PolicyUnavailableException(PolicyUnavailableException.DEFAULT_MESSAGE, cause);
        }
    }
}
