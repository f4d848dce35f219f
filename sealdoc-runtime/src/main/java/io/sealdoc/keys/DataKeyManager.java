/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.keys;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.KeyWrappingException;
import io.sealdoc.NoMasterKeyAvailableException;
import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.metadata.KeySource;
import io.sealdoc.metadata.Metadata;
import io.sealdoc.metadata.OpaqueMasterKey;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * <p>Creates data keys, wraps them with every master key of a document and unwraps them with
 * whichever master key is reachable.</p>
 *
 * <p>Unwrapping succeeds as soon as any one key succeeds. Wrapping is all or nothing: new key sources
 * are only produced once every key has wrapped the data key.</p>
 */
@ThreadSafe
public class DataKeyManager {

    public static final int DATA_KEY_BYTES = 32;
    private static final String DATA_KEY_ALGORITHM = "AES";

    private static final Logger LOGGER = LoggerFactory.getLogger(DataKeyManager.class);

    private final KeyServiceOptions options;
    private final ScheduledExecutorService executor;
    private final BackoffStrategy backoff;
    private final SecureRandom random;

    public DataKeyManager(@NonNull KeyServiceOptions options, @NonNull ScheduledExecutorService executor) {
        this(options, executor, new ExponentialJitterBackoffStrategy(Duration.ofMillis(500), Duration.ofSeconds(5), 2.0, new Random()), new SecureRandom());
    }

    public DataKeyManager(@NonNull KeyServiceOptions options,
                          @NonNull ScheduledExecutorService executor,
                          @NonNull BackoffStrategy backoff,
                          @NonNull SecureRandom random) {
        this.options = Objects.requireNonNull(options);
        this.executor = Objects.requireNonNull(executor);
        this.backoff = Objects.requireNonNull(backoff);
        this.random = Objects.requireNonNull(random);
    }

    /**
     * @return a fresh 256-bit data key. The caller must destroy it.
     */
    public DestroyableRawSecretKey generateDataKey() {
        return DestroyableRawSecretKey.generate(random, DATA_KEY_BYTES, DATA_KEY_ALGORITHM);
    }

    /**
     * Unwraps the data key of a document. Keys are tried in the configured decryption order and then
     * in document order, or all at once if so configured.
     *
     * @param metadata the document metadata
     * @return the data key, which the caller must destroy. Fails with {@link NoMasterKeyAvailableException}
     * listing every key tried if none succeeded.
     */
    public CompletionStage<DestroyableRawSecretKey> dataKey(@NonNull Metadata metadata) {
        List<MasterKey> keys = orderedKeys(metadata.keySources());
        if (keys.isEmpty()) {
            return CompletableFuture.failedFuture(new NoMasterKeyAvailableException(List.of()));
        }
        return options.parallel() ? tryAll(keys) : tryInOrder(keys, 0, new ArrayList<>());
    }

    List<MasterKey> orderedKeys(List<KeySource> sources) {
        var ordered = new ArrayList<MasterKey>();
        for (String preferred : options.decryptionOrder()) {
            sources.stream().filter(s -> s.name().equals(preferred)).forEach(s -> ordered.addAll(s.keys()));
        }
        sources.stream().filter(s -> !options.decryptionOrder().contains(s.name())).forEach(s -> ordered.addAll(s.keys()));
        return ordered;
    }

    private CompletionStage<DestroyableRawSecretKey> tryInOrder(List<MasterKey> keys, int index, List<KeyDecryptionFailure> failures) {
        if (index == keys.size()) {
            return CompletableFuture.failedFuture(new NoMasterKeyAvailableException(failures));
        }
        MasterKey key = keys.get(index);
        return unwrap(key).exceptionallyCompose(e -> {
            failures.add(decryptionFailure(key, e));
            return tryInOrder(keys, index + 1, failures);
        });
    }

    private CompletionStage<DestroyableRawSecretKey> tryAll(List<MasterKey> keys) {
        var result = new CompletableFuture<DestroyableRawSecretKey>();
        var failures = new AtomicReferenceArray<KeyDecryptionFailure>(keys.size());
        var outstanding = new AtomicInteger(keys.size());
        var attempts = new ArrayList<CompletableFuture<DestroyableRawSecretKey>>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            int index = i;
            MasterKey key = keys.get(i);
            CompletableFuture<DestroyableRawSecretKey> attempt = unwrap(key);
            attempts.add(attempt);
            attempt.whenComplete((dataKey, e) -> {
                if (e == null) {
                    if (!result.complete(dataKey)) {
                        dataKey.destroy();
                    }
                }
                else {
                    failures.set(index, decryptionFailure(key, e));
                }
                if (outstanding.decrementAndGet() == 0 && !result.isDone()) {
                    var all = new ArrayList<KeyDecryptionFailure>(keys.size());
                    for (int j = 0; j < failures.length(); j++) {
                        all.add(failures.get(j));
                    }
                    result.completeExceptionally(new NoMasterKeyAvailableException(all));
                }
            });
        }
        result.whenComplete((dataKey, e) -> attempts.forEach(a -> a.cancel(false)));
        return result;
    }

    /**
     * The returned attempt may time out or be cancelled while the backend is still working. A data key
     * the backend produces after that point is destroyed rather than leaked.
     */
    private CompletableFuture<DestroyableRawSecretKey> unwrap(MasterKey key) {
        if (!key.hasEncryptedDataKey()) {
            return CompletableFuture.failedFuture(new KmsException("the key holds no encrypted data key"));
        }
        var attempt = new CompletableFuture<DestroyableRawSecretKey>();
        resilient(key).decrypt()
                .thenApply(DataKeyManager::checkedDataKey)
                .whenComplete((dataKey, e) -> {
                    if (e != null) {
                        attempt.completeExceptionally(e);
                    }
                    else if (attempt.complete(dataKey)) {
                        LOGGER.info("Data key unwrapped with {} key {}", key.typeIdentifier(), key.keyId());
                    }
                    else {
                        LOGGER.debug("Discarding data key unwrapped with {} key {} after the attempt ended", key.typeIdentifier(), key.keyId());
                        dataKey.destroy();
                    }
                });
        return attempt.orTimeout(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private static DestroyableRawSecretKey checkedDataKey(SecretKey unwrapped) {
        DestroyableRawSecretKey dataKey = DestroyableRawSecretKey.toDestroyableKey(unwrapped);
        if (dataKey.numKeyBits() != DATA_KEY_BYTES * Byte.SIZE) {
            int bytes = dataKey.numKeyBits() / Byte.SIZE;
            dataKey.destroy();
            throw new KmsException("unwrapped a " + bytes + "-byte key, expected a " + DATA_KEY_BYTES + "-byte data key");
        }
        return dataKey;
    }

    private KeyDecryptionFailure decryptionFailure(MasterKey key, Throwable e) {
        String message = describe(e);
        LOGGER.debug("Failed to unwrap data key with {} key {}", key.typeIdentifier(), key.keyId(), e);
        LOGGER.info("Failed to unwrap data key with {} key {}: {}", key.typeIdentifier(), key.keyId(), message);
        return new KeyDecryptionFailure(key.typeIdentifier(), key.keyId(), message);
    }

    /**
     * Wraps the data key with every key of every source.
     *
     * @param sources the key sources
     * @param dataKey the data key
     * @return key sources whose keys all carry the data key wrapped afresh. Fails with
     * {@link KeyWrappingException} if any key failed.
     */
    public CompletionStage<List<KeySource>> wrapAll(@NonNull List<KeySource> sources, @NonNull SecretKey dataKey) {
        return wrap(sources, dataKey, true);
    }

    /**
     * Wraps the data key with the keys that hold no wrapped data key yet. Other keys are left as they are.
     *
     * @param sources the key sources
     * @param dataKey the data key
     * @return the updated key sources. Fails with {@link KeyWrappingException} if any key failed.
     */
    public CompletionStage<List<KeySource>> wrapIfNeeded(@NonNull List<KeySource> sources, @NonNull SecretKey dataKey) {
        return wrap(sources, dataKey, false);
    }

    private CompletionStage<List<KeySource>> wrap(List<KeySource> sources, SecretKey dataKey, boolean all) {
        var wrapped = new ArrayList<List<CompletableFuture<MasterKey>>>(sources.size());
        for (KeySource source : sources) {
            wrapped.add(source.keys().stream()
                    .map(key -> all || !key.hasEncryptedDataKey() ? wrap(key, dataKey) : CompletableFuture.completedFuture(key))
                    .toList());
        }
        CompletableFuture<?>[] pending = wrapped.stream().flatMap(List::stream).toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(pending).handle((ignored, e) -> {
            var failures = new ArrayList<KeyWrappingFailure>();
            var result = new ArrayList<KeySource>(sources.size());
            for (int i = 0; i < sources.size(); i++) {
                KeySource source = sources.get(i);
                var keys = new ArrayList<MasterKey>(source.keys().size());
                for (int j = 0; j < source.keys().size(); j++) {
                    MasterKey original = source.keys().get(j);
                    CompletableFuture<MasterKey> future = wrapped.get(i).get(j);
                    Throwable failure = future.handle((k, t) -> t).join();
                    if (failure == null) {
                        keys.add(future.join());
                    }
                    else {
                        failures.add(new KeyWrappingFailure(original.typeIdentifier(), original.keyId(), describe(failure)));
                    }
                }
                result.add(source.withKeys(keys));
            }
            if (!failures.isEmpty()) {
                throw new KeyWrappingException(failures);
            }
            return result;
        });
    }

    private CompletableFuture<MasterKey> wrap(MasterKey key, SecretKey dataKey) {
        return resilient(key).wrap(dataKey)
                .toCompletableFuture()
                .orTimeout(options.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((k, e) -> {
                    if (e == null) {
                        LOGGER.info("Data key wrapped with {} key {}", key.typeIdentifier(), key.keyId());
                    }
                    else {
                        LOGGER.debug("Failed to wrap data key with {} key {}", key.typeIdentifier(), key.keyId(), e);
                    }
                });
    }

    private MasterKey resilient(MasterKey key) {
        if (key instanceof OpaqueMasterKey || options.retries() == 0) {
            return key;
        }
        return ResilientMasterKey.wrap(key, executor, backoff, options.retries());
    }

    private String describe(Throwable e) {
        Throwable cause = e;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out after " + options.timeout();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Adds keys to the sources of the same backend, creating sources as needed. Keys already present are not added again.
     * @param sources existing sources
     * @param added sources of keys to add
     * @return the new sources
     */
    public static List<KeySource> addKeys(@NonNull List<KeySource> sources, @NonNull List<KeySource> added) {
        var byName = new LinkedHashMap<String, List<MasterKey>>();
        sources.forEach(s -> byName.computeIfAbsent(s.name(), n -> new ArrayList<>()).addAll(s.keys()));
        for (KeySource source : added) {
            List<MasterKey> keys = byName.computeIfAbsent(source.name(), n -> new ArrayList<>());
            for (MasterKey key : source.keys()) {
                if (keys.stream().noneMatch(k -> k.keyId().equals(key.keyId()))) {
                    keys.add(key);
                }
            }
        }
        return toSources(byName);
    }

    /**
     * Removes keys. Sources left without keys are dropped.
     * @param sources existing sources
     * @param removed keys to remove, matched by type and key id
     * @return the new sources
     */
    public static List<KeySource> removeKeys(@NonNull List<KeySource> sources, @NonNull Collection<MasterKey> removed) {
        var byName = new LinkedHashMap<String, List<MasterKey>>();
        for (KeySource source : sources) {
            List<MasterKey> kept = source.keys().stream()
                    .filter(key -> removed.stream().noneMatch(r -> r.typeIdentifier().equals(key.typeIdentifier()) && r.keyId().equals(key.keyId())))
                    .toList();
            byName.computeIfAbsent(source.name(), n -> new ArrayList<>()).addAll(kept);
        }
        return toSources(byName);
    }

    /**
     * @param sources key sources
     * @return the sources with every wrapped data key cleared
     */
    public static List<KeySource> clearEncryptedDataKeys(@NonNull List<KeySource> sources) {
        return sources.stream()
                .map(s -> s.withKeys(s.keys().stream().map(k -> k.withEncryptedDataKey(null, k.creationDate())).toList()))
                .toList();
    }

    private static List<KeySource> toSources(Map<String, List<MasterKey>> byName) {
        return byName.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(e -> new KeySource(e.getKey(), e.getValue()))
                .toList();
    }
}
