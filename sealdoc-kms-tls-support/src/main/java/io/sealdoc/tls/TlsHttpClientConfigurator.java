/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tls;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Builder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.config.secret.PasswordProvider;
import io.sealdoc.config.tls.AllowDeny;
import io.sealdoc.config.tls.InsecureTls;
import io.sealdoc.config.tls.KeyProvider;
import io.sealdoc.config.tls.PlatformTrustProvider;
import io.sealdoc.config.tls.Tls;
import io.sealdoc.config.tls.TrustProvider;
import io.sealdoc.config.tls.TrustProviderVisitor;
import io.sealdoc.config.tls.TrustStore;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Turns the {@link Tls} block of a backend's configuration into JSSE objects.
 * <p>
 * Backends built on {@link HttpClient} use the configurator directly as a builder operator.
 * Backends with their own HTTP stack take the {@link #trustManagers()} and {@link #keyManagers()}
 * instead. Stores are read from disk each time managers are requested.
 */
public class TlsHttpClientConfigurator implements UnaryOperator<Builder> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TlsHttpClientConfigurator.class);

    private static final TrustManager[] INSECURE_TRUST_MANAGERS = { new InsecureTrustManager() };

    @Nullable
    private final Tls tls;

    /**
     * @param tls tls parameters, or null to use the platform defaults.
     */
    public TlsHttpClientConfigurator(@Nullable Tls tls) {
        this.tls = tls;
    }

    /**
     * Trust managers for the configured trust, or null when the platform's should be used.
     *
     * @return trust managers, or null
     * @throws SslConfigurationException if the trust store cannot be loaded
     */
    @Nullable
    public TrustManager[] trustManagers() {
        return tls == null || tls.trust() == null ? null : trustManagersFor(tls.trust());
    }

    /**
     * Key managers presenting the configured client certificate, or null when none is configured.
     *
     * @return key managers, or null
     * @throws SslConfigurationException if the key store cannot be loaded
     */
    @Nullable
    public KeyManager[] keyManagers() {
        return tls == null || tls.key() == null ? null : keyManagersFor(tls.key());
    }

    SSLContext sslContext() {
        var trustManagers = trustManagers();
        var keyManagers = keyManagers();
        if (trustManagers == null && keyManagers == null) {
            return Platform.CONTEXT;
        }
        try {
            var context = SSLContext.getInstance("TLS");
            context.init(keyManagers, trustManagers, new SecureRandom());
            return context;
        }
        catch (GeneralSecurityException e) {
            throw new SslConfigurationException(e);
        }
    }

    SSLParameters sslParameters() {
        var parameters = Platform.CONTEXT.getDefaultSSLParameters();
        if (tls == null) {
            return parameters;
        }
        var supported = Platform.CONTEXT.getSupportedSSLParameters();
        if (tls.protocols() != null) {
            parameters.setProtocols(restrict("protocol", tls.protocols(), parameters.getProtocols(), supported.getProtocols()));
        }
        if (tls.cipherSuites() != null) {
            parameters.setCipherSuites(restrict("cipher suite", tls.cipherSuites(), parameters.getCipherSuites(), supported.getCipherSuites()));
        }
        return parameters;
    }

    /**
     * An allow list replaces the platform defaults, a deny list then removes from what remains.
     * Names the platform does not recognise are logged and ignored.
     */
    @NonNull
    private static String[] restrict(String subject, AllowDeny<String> allowDeny, String[] defaults, String[] supported) {
        Set<String> known = Set.of(supported);
        List<String> allowed = allowDeny.allowed();
        Set<String> denied = allowDeny.denied() == null ? Set.of() : allowDeny.denied();
        warnUnknown("allowed", subject, allowed == null ? List.of() : allowed, known);
        warnUnknown("denied", subject, denied, known);

        Set<String> result = new LinkedHashSet<>(allowed == null || allowed.isEmpty() ? Arrays.asList(defaults) : allowed);
        result.retainAll(known);
        result.removeAll(denied);
        if (result.isEmpty()) {
            throw new SslConfigurationException(
                    "The configuration you have in place has resulted in no %ss being available. Allowed: %s, Denied: %s".formatted(subject, allowed,
                            allowDeny.denied()));
        }
        return result.toArray(String[]::new);
    }

    private static void warnUnknown(String list, String subject, Iterable<String> names, Set<String> known) {
        List<String> unknown = new ArrayList<>();
        names.forEach(name -> {
            if (!known.contains(name)) {
                unknown.add(name);
            }
        });
        if (!unknown.isEmpty()) {
            LOGGER.warn("Ignoring {} {}s {} as this platform does not recognise them", list, subject, unknown);
        }
    }

    static KeyManager[] keyManagersFor(KeyProvider key) {
        return key.accept(keyStore -> {
            char[] storePassword = passwordOf(keyStore.storePasswordProvider());
            char[] keyPassword = passwordOf(keyStore.keyPasswordProvider());
            var store = loadStore(keyStore.getType(), keyStore.storeFile(), storePassword);
            try {
                var factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
                factory.init(store, keyPassword == null ? storePassword : keyPassword);
                return factory.getKeyManagers();
            }
            catch (GeneralSecurityException e) {
                throw new SslConfigurationException(e);
            }
        });
    }

    static TrustManager[] trustManagersFor(TrustProvider trust) {
        KeyStore anchors = trust.accept(new TrustProviderVisitor<KeyStore>() {
            @Override
            public KeyStore visit(TrustStore trustStore) {
                return loadStore(trustStore.getType(), trustStore.storeFile(), passwordOf(trustStore.storePasswordProvider()));
            }

            @Override
            public KeyStore visit(InsecureTls insecureTls) {
                return null;
            }

            @Override
            public KeyStore visit(PlatformTrustProvider platformTrustProvider) {
                return null;
            }
        });
        if (trust instanceof InsecureTls insecureTls && insecureTls.insecure()) {
            LOGGER.warn("Backend server certificates will not be verified");
            return INSECURE_TRUST_MANAGERS;
        }
        try {
            var factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            // a null store selects the platform's default anchors
            factory.init(anchors);
            return factory.getTrustManagers();
        }
        catch (GeneralSecurityException e) {
            throw new SslConfigurationException(e);
        }
    }

    private static KeyStore loadStore(String type, String file, @Nullable char[] password) {
        try (InputStream in = Files.newInputStream(Path.of(file))) {
            var store = KeyStore.getInstance(type);
            store.load(in, password);
            return store;
        }
        catch (IOException | GeneralSecurityException e) {
            throw new SslConfigurationException(e);
        }
    }

    @Nullable
    private static char[] passwordOf(@Nullable PasswordProvider provider) {
        return provider == null ? null : provider.getProvidedPassword().toCharArray();
    }

    /**
     * Applies TLS configuration to the supplied {@link Builder}.  If there is no
     * TLS configuration to apply, the platform defaults are applied.
     *
     * @param builder HTTP client builder
     * @return HTTP client builder
     */
    @Override
    public Builder apply(@NonNull Builder builder) {
        Objects.requireNonNull(builder);
        return builder.sslContext(sslContext())
                .sslParameters(sslParameters());
    }

    private static final class Platform {
        private static final SSLContext CONTEXT;

        static {
            try {
                CONTEXT = SSLContext.getDefault();
            }
            catch (NoSuchAlgorithmException e) {
                throw new SslConfigurationException(e);
            }
        }
    }
}
