/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.keys;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.service.InvalidKeyEntryException;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.UnknownKeyException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Retries the backend operations of a master key with backoff. Failures that retrying cannot fix,
 * such as an unknown key, fail immediately.
 */
public class ResilientMasterKey implements MasterKey {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResilientMasterKey.class);

    private final MasterKey inner;
    private final ScheduledExecutorService executorService;
    private final BackoffStrategy strategy;
    private final int retries;

    private ResilientMasterKey(MasterKey inner,
                               ScheduledExecutorService executorService,
                               BackoffStrategy strategy,
                               int retries) {
        this.inner = inner;
        this.executorService = executorService;
        this.strategy = strategy;
        this.retries = retries;
    }

    /**
     * @param delegate the key
     * @param executorService executor used to schedule retries
     * @param strategy backoff between attempts
     * @param retries retries after the first attempt
     * @return a key retrying the delegate's operations
     */
    public static MasterKey wrap(MasterKey delegate,
                                 ScheduledExecutorService executorService,
                                 BackoffStrategy strategy,
                                 int retries) {
        return new ResilientMasterKey(delegate, executorService, strategy, retries);
    }

    @Override
    public @NonNull String typeIdentifier() {
        return inner.typeIdentifier();
    }

    @Override
    public @NonNull String keyId() {
        return inner.keyId();
    }

    @Override
    public @NonNull Instant creationDate() {
        return inner.creationDate();
    }

    @Override
    public @Nullable String encryptedDataKey() {
        return inner.encryptedDataKey();
    }

    /**
     * @return the updated delegate, which does not retry.
     */
    @Override
    public @NonNull MasterKey withEncryptedDataKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        return inner.withEncryptedDataKey(encryptedDataKey, creationDate);
    }

    @Override
    public @NonNull CompletionStage<String> encrypt(@NonNull SecretKey dataKey) {
        return retry("encrypt", () -> inner.encrypt(dataKey));
    }

    @Override
    public @NonNull CompletionStage<SecretKey> decrypt() {
        return retry("decrypt", inner::decrypt);
    }

    @Override
    public boolean needsRotation(@NonNull Instant now) {
        return inner.needsRotation(now);
    }

    @Override
    public @NonNull Map<String, Object> toMap() {
        return inner.toMap();
    }

    <A> CompletionStage<A> retry(String name, Supplier<CompletionStage<A>> operation) {
        return retry(name, operation, 0);
    }

    private <A> CompletionStage<A> retry(String name, Supplier<CompletionStage<A>> operation, int attempt) {
        Duration delay = strategy.getDelay(attempt);
        return schedule(operation, delay)
                .exceptionallyCompose(e -> {
                    Throwable cause = e instanceof CompletionException ce && ce.getCause() != null ? ce.getCause() : e;
                    if (isPermanent(cause)) {
                        LOGGER.debug("not retrying {} with {} key {}: {}", name, typeIdentifier(), keyId(), cause.toString());
                        return CompletableFuture.failedFuture(cause);
                    }
                    if (attempt >= retries) {
                        return CompletableFuture.failedFuture(new KmsException(name + " failed after " + (attempt + 1) + " attempts: " + cause.getMessage(), cause));
                    }
                    LOGGER.debug("{} with {} key {} failed attempt {}", name, typeIdentifier(), keyId(), attempt, cause);
                    return retry(name, operation, attempt + 1);
                });
    }

    private static boolean isPermanent(Throwable e) {
        return e instanceof UnknownKeyException || e instanceof InvalidKeyEntryException;
    }

    private <A> CompletionStage<A> schedule(Supplier<CompletionStage<A>> operation, Duration duration) {
        if (duration.equals(Duration.ZERO)) {
            return invoke(operation);
        }
        CompletableFuture<A> future = new CompletableFuture<>();
        executorService.schedule(() -> {
            invoke(operation).whenComplete((a, throwable) -> {
                if (throwable != null) {
                    future.completeExceptionally(throwable);
                }
                else {
                    future.complete(a);
                }
            });
        }, duration.toMillis(), TimeUnit.MILLISECONDS);
        return future;
    }

    private static <A> CompletionStage<A> invoke(Supplier<CompletionStage<A>> operation) {
        try {
            return operation.get();
        }
        catch (KmsException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public String toString() {
        return "ResilientMasterKey[" + inner + "]";
    }
}
