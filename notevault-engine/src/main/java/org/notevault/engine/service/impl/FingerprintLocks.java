package org.notevault.engine.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Serializes work on one content fingerprint inside this engine process.
 * <p>
 * Uploads hold the lock from the blob check to the catalog registration and purges hold it from the
 * reference count to the blob deletion, so a purge never deletes a blob that a concurrent upload
 * has just registered. Fingerprints are spread over a fixed set of striped semaphores.
 */
@Slf4j
@Service
public class FingerprintLocks {

    private static final int DEFAULT_STRIPES = 64;

    private final Semaphore[] stripes;

    public FingerprintLocks() {
        this(DEFAULT_STRIPES);
    }

    FingerprintLocks(int stripeCount) {
        stripes = new Semaphore[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new Semaphore(1);
        }
    }

    public <T> Mono<T> withLock(String fingerprint, Supplier<Mono<T>> action) {
        Semaphore stripe = stripes[Math.floorMod(fingerprint.hashCode(), stripes.length)];
        return Mono.usingWhen(
                Mono.fromCallable(() -> {
                    stripe.acquire();
                    log.trace("Lock acquired for {}", fingerprint);
                    return stripe;
                }).subscribeOn(Schedulers.boundedElastic()),
                acquired -> action.get(),
                acquired -> Mono.fromRunnable(acquired::release));
    }
}
