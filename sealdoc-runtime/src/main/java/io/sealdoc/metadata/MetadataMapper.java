/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.metadata;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.DocumentParseException;
import io.sealdoc.config.MasterKeyServiceRegistry;
import io.sealdoc.kms.service.KeyEntries;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.walk.CryptRule;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * <p>Converts {@link Metadata} to and from the generic maps and lists a store reads and writes.</p>
 *
 * <p>Any list valued field is a list of master keys of the backend named by the field. Keys of backends
 * that are registered are built by that backend's service; keys of other backends are kept as
 * {@link OpaqueMasterKey}s so they survive a rewrite of the document.</p>
 */
public class MetadataMapper {

    public static final String LAST_MODIFIED = "lastmodified";
    public static final String MAC = "mac";
    public static final String VERSION = "version";

    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataMapper.class);

    private final MasterKeyServiceRegistry services;

    public MetadataMapper(@NonNull MasterKeyServiceRegistry services) {
        this.services = Objects.requireNonNull(services);
    }

    /**
     * @param metadata metadata
     * @return the map to store under the reserved key, in the order fields should be written.
     */
    public Map<String, Object> toMap(@NonNull Metadata metadata) {
        var map = new LinkedHashMap<String, Object>();
        for (KeySource source : metadata.keySources()) {
            if (!source.keys().isEmpty()) {
                map.put(source.name(), source.keys().stream().map(MasterKey::toMap).toList());
            }
        }
        map.put(LAST_MODIFIED, KeyEntries.formatTimestamp(metadata.lastModified()));
        if (metadata.mac() != null) {
            map.put(MAC, metadata.mac());
        }
        map.put(metadata.cryptRule().kind().metadataKey(), metadata.cryptRule().value());
        map.put(VERSION, metadata.version());
        return map;
    }

    /**
     * @param map the map stored under the reserved key
     * @return the metadata
     * @throws DocumentParseException if the map is not valid metadata
     */
    public Metadata fromMap(@NonNull Map<String, ?> map) {
        OffsetDateTime lastModified = null;
        String mac = null;
        String version = null;
        CryptRule rule = null;
        var keySources = new ArrayList<KeySource>();
        for (Map.Entry<String, ?> field : map.entrySet()) {
            String name = field.getKey();
            Object value = field.getValue();
            Optional<CryptRule.Kind> ruleKind = CryptRule.Kind.fromMetadataKey(name);
            if (LAST_MODIFIED.equals(name)) {
                lastModified = parseLastModified(value);
            }
            else if (MAC.equals(name)) {
                mac = requireText(name, value);
            }
            else if (VERSION.equals(name)) {
                version = versionText(value);
            }
            else if (ruleKind.isPresent()) {
                if (rule != null) {
                    throw new DocumentParseException("metadata sets more than one of "
                            + rule.kind().metadataKey() + " and " + name + "; only one may be used");
                }
                rule = cryptRule(ruleKind.get(), requireText(name, value));
            }
            else if (value instanceof List<?> entries) {
                if (!entries.isEmpty()) {
                    keySources.add(keySource(name, entries));
                }
            }
            else {
                LOGGER.debug("ignoring unsupported metadata field '{}'", name);
            }
        }
        if (lastModified == null) {
            throw new DocumentParseException("metadata has no '" + LAST_MODIFIED + "' field");
        }
        if (mac == null || mac.isEmpty()) {
            LOGGER.warn("metadata has no MAC; the integrity of the document cannot be verified");
            mac = null;
        }
        if (version == null) {
            LOGGER.debug("metadata has no version, assuming {}", Metadata.FORMAT_VERSION);
            version = Metadata.FORMAT_VERSION;
        }
        return new Metadata(version, rule == null ? CryptRule.DEFAULT : rule, mac, lastModified, keySources);
    }

    private KeySource keySource(String name, List<?> entries) {
        Optional<MasterKeyService<?>> service = services.service(name);
        if (service.isEmpty()) {
            LOGGER.debug("no backend is registered for '{}'; its keys are kept but cannot be used", name);
        }
        var keys = new ArrayList<MasterKey>(entries.size());
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> raw)) {
                throw new DocumentParseException("'" + name + "' must be a list of key entries");
            }
            Map<String, Object> keyEntry = stringKeyed(name, raw);
            if (service.isPresent()) {
                try {
                    keys.add(service.get().fromMap(keyEntry));
                }
                catch (KmsException e) {
                    throw new DocumentParseException("invalid '" + name + "' key entry: " + e.getMessage(), e);
                }
            }
            else {
                keys.add(new OpaqueMasterKey(name, keyEntry));
            }
        }
        return new KeySource(name, keys);
    }

    private static Map<String, Object> stringKeyed(String name, Map<?, ?> raw) {
        var result = new LinkedHashMap<String, Object>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            if (!(e.getKey() instanceof String key)) {
                throw new DocumentParseException("'" + name + "' key entry has a non-text field name");
            }
            result.put(key, e.getValue());
        }
        return result;
    }

    private static OffsetDateTime parseLastModified(Object value) {
        String text = requireText(LAST_MODIFIED, value);
        try {
            return KeyEntries.parseOffsetTimestamp(text);
        }
        catch (KmsException e) {
            throw new DocumentParseException("metadata field '" + LAST_MODIFIED + "' is not an RFC 3339 timestamp: " + text, e);
        }
    }

    private static CryptRule cryptRule(CryptRule.Kind kind, String value) {
        try {
            return new CryptRule(kind, value);
        }
        catch (PatternSyntaxException e) {
            throw new DocumentParseException("metadata field '" + kind.metadataKey() + "' is not a valid regular expression", e);
        }
    }

    private static String versionText(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return value.toString();
        }
        if (value instanceof Number n) {
            return BigDecimal.valueOf(n.doubleValue()).stripTrailingZeros().toPlainString();
        }
        return requireText(VERSION, value);
    }

    private static String requireText(String name, Object value) {
        if (value instanceof String s) {
            return s;
        }
        throw new DocumentParseException("metadata field '" + name + "' must be text");
    }
}
