/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.cipher.AesGcmValueCipher;
import io.sealdoc.config.ConfigParser;
import io.sealdoc.config.Configuration;
import io.sealdoc.config.MasterKeyServiceRegistry;
import io.sealdoc.keys.DataKeyManager;
import io.sealdoc.keys.KeyServiceOptions;
import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.KeyEntries;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.mac.MacAccumulator;
import io.sealdoc.metadata.KeySource;
import io.sealdoc.metadata.Metadata;
import io.sealdoc.metadata.MetadataMapper;
import io.sealdoc.store.Store;
import io.sealdoc.tree.Scalar;
import io.sealdoc.tree.TreeBranch;
import io.sealdoc.tree.TreePath;
import io.sealdoc.tree.TreeValue;
import io.sealdoc.walk.CryptRule;
import io.sealdoc.walk.TreeWalker;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Encrypts, decrypts and re-keys documents.</p>
 *
 * <p>Every operation that needs a data key obtains it, uses it and destroys it before returning.
 * Operations that change the master keys of a document only return a result once every affected key
 * has wrapped the data key; a failed operation returns nothing.</p>
 *
 * <p>A {@code Sealdoc} owns the registry of backends it was created with and closes it on {@link #close()}.</p>
 */
public class Sealdoc implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Sealdoc.class);

    private final MasterKeyServiceRegistry registry;
    private final MetadataMapper metadataMapper;
    private final ScheduledExecutorService executor;
    private final DataKeyManager dataKeys;
    private final AesGcmValueCipher cipher;
    private final TreeWalker walker;
    private final Clock clock;

    public Sealdoc(@NonNull MasterKeyServiceRegistry registry, @NonNull KeyServiceOptions options) {
        this(registry, options, Clock.systemUTC());
    }

    Sealdoc(MasterKeyServiceRegistry registry, KeyServiceOptions options, Clock clock) {
        this.registry = Objects.requireNonNull(registry);
        this.metadataMapper = new MetadataMapper(registry);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "sealdoc-key-service");
            thread.setDaemon(true);
            return thread;
        });
        this.dataKeys = new DataKeyManager(options, executor);
        this.cipher = new AesGcmValueCipher();
        this.walker = new TreeWalker(cipher);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @param configuration configuration
     * @return an instance using the backends and key service options of the configuration
     */
    public static Sealdoc fromConfiguration(@NonNull Configuration configuration) {
        var registry = MasterKeyServiceRegistry.fromConfiguration(new ConfigParser(), configuration);
        return new Sealdoc(registry, configuration.keyService());
    }

    public MasterKeyServiceRegistry registry() {
        return registry;
    }

    /**
     * @return the mapper stores use to read and write metadata with the backends of this instance
     */
    public MetadataMapper metadataMapper() {
        return metadataMapper;
    }

    /**
     * Decrypts a serialized document.
     * @param document document bytes
     * @param store the store for the document's format
     * @param options options
     * @return the plaintext values and the metadata
     * @throws MetadataNotFoundException if the document is not encrypted
     * @throws NoMasterKeyAvailableException if no master key could unwrap the data key
     * @throws AuthenticationFailureException if a value failed authentication
     * @throws MacMismatchException if the document MAC does not verify and {@code options} do not ignore it
     */
    public DecryptResult decrypt(byte[] document, @NonNull Store store, @NonNull DecryptOptions options) {
        Metadata metadata = store.unmarshalMetadata(document);
        TreeBranch tree = store.unmarshal(document);
        return decrypt(tree, metadata, options);
    }

    public DecryptResult decrypt(@NonNull TreeBranch tree, @NonNull Metadata metadata, @NonNull DecryptOptions options) {
        DestroyableRawSecretKey dataKey = await(dataKeys.dataKey(metadata));
        try {
            var warnings = new ArrayList<String>();
            Verified verified = decryptAndVerify(tree, metadata, dataKey, options.ignoreMac(), warnings);
            return new DecryptResult(verified.tree(), metadata, warnings);
        }
        finally {
            dataKey.destroy();
        }
    }

    /**
     * Encrypts a plaintext document under a new data key wrapped by every given master key.
     * @param tree plaintext values
     * @param keySources master keys, which need hold no wrapped data key
     * @param cryptRule which values to encrypt
     * @return the encrypted document
     * @throws DocumentAlreadyEncryptedException if the tree already holds metadata
     * @throws KeyWrappingException if any master key failed to wrap the data key
     */
    public EncryptedDocument encrypt(@NonNull TreeBranch tree, @NonNull List<KeySource> keySources, @NonNull CryptRule cryptRule) {
        if (tree.containsKey(Metadata.RESERVED_KEY)) {
            throw new DocumentAlreadyEncryptedException("the document already has a '" + Metadata.RESERVED_KEY + "' key and may already be encrypted");
        }
        requireKeys(keySources);
        DestroyableRawSecretKey dataKey = dataKeys.generateDataKey();
        try {
            List<KeySource> wrapped = await(dataKeys.wrapAll(keySources, dataKey));
            Metadata metadata = new Metadata(Metadata.FORMAT_VERSION, cryptRule, null, now(), wrapped);
            return seal(tree, metadata, dataKey);
        }
        finally {
            dataKey.destroy();
        }
    }

    /**
     * Replaces the data key of a document. The document is decrypted and verified with the old data key,
     * and re-encrypted with a new one that every master key wraps afresh.
     * @param metadata metadata
     * @param tree encrypted values
     * @return the re-encrypted document
     */
    public EncryptedDocument rotate(@NonNull Metadata metadata, @NonNull TreeBranch tree) {
        TreeBranch plaintext;
        DestroyableRawSecretKey oldKey = await(dataKeys.dataKey(metadata));
        try {
            plaintext = decryptAndVerify(tree, metadata, oldKey, false, List.of()).tree();
        }
        finally {
            oldKey.destroy();
        }
        DestroyableRawSecretKey newKey = dataKeys.generateDataKey();
        try {
            List<KeySource> wrapped = await(dataKeys.wrapAll(DataKeyManager.clearEncryptedDataKeys(metadata.keySources()), newKey));
            EncryptedDocument rotated = seal(plaintext, metadata.withKeySources(wrapped).withVersion(Metadata.FORMAT_VERSION), newKey);
            LOGGER.info("Rotated the data key of the document");
            return rotated;
        }
        finally {
            newKey.destroy();
        }
    }

    /**
     * Adds and removes master keys. The data key is unchanged; it is wrapped only by the added keys.
     * @param metadata metadata
     * @param tree encrypted values, which are returned unchanged
     * @param added keys to add
     * @param removed keys to remove
     * @return the document with updated metadata
     * @throws IllegalArgumentException if no master keys would remain
     */
    public EncryptedDocument updateKeys(@NonNull Metadata metadata,
                                        @NonNull TreeBranch tree,
                                        @NonNull List<KeySource> added,
                                        @NonNull Collection<MasterKey> removed) {
        List<KeySource> sources = DataKeyManager.removeKeys(DataKeyManager.addKeys(metadata.keySources(), added), removed);
        requireKeys(sources);
        DestroyableRawSecretKey dataKey = await(dataKeys.dataKey(metadata));
        try {
            Verified verified = decryptAndVerify(tree, metadata, dataKey, false, List.of());
            List<KeySource> wrapped = await(dataKeys.wrapIfNeeded(sources, dataKey));
            OffsetDateTime lastModified = now();
            return new EncryptedDocument(tree, metadata.withKeySources(wrapped).withMac(encryptMac(verified.mac(), lastModified, dataKey), lastModified));
        }
        finally {
            dataKey.destroy();
        }
    }

    /**
     * Sets a single value of a document, keeping its data key.
     * @param tree encrypted values
     * @param metadata metadata
     * @param path where to set the value
     * @param value the plaintext value
     * @return the re-encrypted document
     */
    public EncryptedDocument set(@NonNull TreeBranch tree, @NonNull Metadata metadata, @NonNull TreePath path, @NonNull TreeValue value) {
        DestroyableRawSecretKey dataKey = await(dataKeys.dataKey(metadata));
        try {
            TreeBranch plaintext = decryptAndVerify(tree, metadata, dataKey, false, List.of()).tree();
            return seal(path.set(plaintext, value), metadata, dataKey);
        }
        finally {
            dataKey.destroy();
        }
    }

    private record Verified(TreeBranch tree, String mac) {}

    private Verified decryptAndVerify(TreeBranch tree, Metadata metadata, SecretKey dataKey, boolean ignoreMac, List<String> warnings) {
        var mac = new MacAccumulator();
        TreeBranch plaintext = walker.decrypt(tree, dataKey, metadata.cryptRule(), mac);
        String computed = mac.hexDigest();
        if (metadata.mac() == null) {
            macProblem("the document has no MAC", null, ignoreMac, warnings);
            return new Verified(plaintext, computed);
        }
        Scalar stored;
        try {
            stored = cipher.decrypt(metadata.mac(), dataKey, KeyEntries.formatTimestamp(metadata.lastModified()));
        }
        catch (AuthenticationFailureException | DocumentParseException e) {
            macProblem("the document MAC could not be decrypted", e, ignoreMac, warnings);
            return new Verified(plaintext, computed);
        }
        if (!(stored instanceof Scalar.StringValue storedMac) || !MacAccumulator.matches(storedMac.value(), computed)) {
            macProblem("the MAC of the document does not match its content", null, ignoreMac, warnings);
        }
        return new Verified(plaintext, computed);
    }

    private static void macProblem(String problem, @Nullable Exception cause, boolean ignoreMac, List<String> warnings) {
        if (!ignoreMac) {
            throw cause == null ? new MacMismatchException(problem) : new MacMismatchException(problem, cause);
        }
        LOGGER.warn("Ignoring integrity failure: {}", problem);
        warnings.add(problem);
    }

    private EncryptedDocument seal(TreeBranch plaintext, Metadata metadata, SecretKey dataKey) {
        var mac = new MacAccumulator();
        TreeBranch encrypted = walker.encrypt(plaintext, dataKey, metadata.cryptRule(), mac);
        OffsetDateTime lastModified = now();
        return new EncryptedDocument(encrypted, metadata.withMac(encryptMac(mac.hexDigest(), lastModified, dataKey), lastModified));
    }

    private String encryptMac(String mac, OffsetDateTime lastModified, SecretKey dataKey) {
        return cipher.encrypt(Scalar.of(mac), dataKey, KeyEntries.formatTimestamp(lastModified));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant().truncatedTo(ChronoUnit.SECONDS), ZoneOffset.UTC);
    }

    private static void requireKeys(List<KeySource> sources) {
        if (sources.stream().allMatch(s -> s.keys().isEmpty())) {
            throw new IllegalArgumentException("a document needs at least one master key");
        }
    }

    private static <T> T await(CompletionStage<T> stage) {
        try {
            return stage.toCompletableFuture().join();
        }
        catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new SealdocException("key operation failed", e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        registry.close();
    }
}
