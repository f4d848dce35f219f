/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tls;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.NoSuchFileException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import org.junit.jupiter.api.Test;

import io.sealdoc.config.secret.InlinePassword;
import io.sealdoc.config.tls.AllowDeny;
import io.sealdoc.config.tls.InsecureTls;
import io.sealdoc.config.tls.KeyStore;
import io.sealdoc.config.tls.PlatformTrustProvider;
import io.sealdoc.config.tls.Tls;
import io.sealdoc.config.tls.TrustStore;

import static io.sealdoc.tls.CertificateGenerator.generateRsaKeyPair;
import static io.sealdoc.tls.CertificateGenerator.generateSelfSignedX509Certificate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TlsHttpClientConfiguratorTest {
    private static final java.security.KeyPair KEY_PAIR = generateRsaKeyPair();
    private static final X509Certificate SELF_SIGNED = generateSelfSignedX509Certificate(KEY_PAIR);
    private static final String TLS_V1_3 = "TLSv1.3";
    private static final String TLS_V1_2 = "TLSv1.2";

    private final HttpClient.Builder builder = HttpClient.newBuilder();

    @Test
    void insecureTrustAcceptsAnyCertificate() {
        TrustManager[] trustManagers = TlsHttpClientConfigurator.trustManagersFor(new InsecureTls(true));
        assertThat(trustManagers).singleElement().isInstanceOfSatisfying(X509TrustManager.class, x509TrustManager -> {
            assertThat(x509TrustManager.getAcceptedIssuers()).isEmpty();
            assertThatCode(() -> x509TrustManager.checkServerTrusted(new X509Certificate[]{ SELF_SIGNED }, "any")).doesNotThrowAnyException();
        });
    }

    @Test
    void secureTrustRejectsSelfSignedCertificate() {
        for (var provider : List.of(new InsecureTls(false), PlatformTrustProvider.INSTANCE)) {
            TrustManager[] trustManagers = TlsHttpClientConfigurator.trustManagersFor(provider);
            assertThat(trustManagers).allSatisfy(tm -> assertThat(tm).isInstanceOfSatisfying(X509TrustManager.class,
                    x509TrustManager -> assertThatThrownBy(() -> x509TrustManager.checkServerTrusted(new X509Certificate[]{ SELF_SIGNED }, "RSA"))
                            .isInstanceOf(CertificateException.class)));
        }
    }

    @Test
    void noTlsUsesPlatformContext() throws NoSuchAlgorithmException {
        new TlsHttpClientConfigurator(null).apply(builder);
        assertThat(builder.build().sslContext()).isSameAs(SSLContext.getDefault());

        new TlsHttpClientConfigurator(new Tls(null, null, null, null)).apply(builder);
        assertThat(builder.build().sslContext()).isSameAs(SSLContext.getDefault());
    }

    @Test
    void suppliedTrustBuildsDedicatedContext() throws NoSuchAlgorithmException {
        new TlsHttpClientConfigurator(new Tls(null, new InsecureTls(true), null, null)).apply(builder);
        SSLContext sslContext = builder.build().sslContext();
        assertThat(sslContext).isNotSameAs(SSLContext.getDefault());
        assertThat(sslContext.getProtocol()).isEqualTo("TLS");
    }

    @Test
    void trustStoreFileNotFound() {
        TrustStore store = new TrustStore("/tmp/" + UUID.randomUUID(), new InlinePassword("changeit"), null);
        assertThatThrownBy(() -> TlsHttpClientConfigurator.trustManagersFor(store))
                .isInstanceOf(SslConfigurationException.class)
                .cause().isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void loadsPkcs12TrustStore() {
        var generated = CertificateGenerator.trustStore(SELF_SIGNED, CertificateGenerator.PKCS_12, "changeit");
        TrustStore store = new TrustStore(generated.path().toString(), new InlinePassword("changeit"), generated.type());
        assertThat(TlsHttpClientConfigurator.trustManagersFor(store)).isNotEmpty();
    }

    @Test
    void loadsPasswordlessTrustStore() {
        var generated = CertificateGenerator.trustStore(SELF_SIGNED, CertificateGenerator.PKCS_12, null);
        TrustStore store = new TrustStore(generated.path().toString(), null, generated.type());
        assertThat(TlsHttpClientConfigurator.trustManagersFor(store)).isNotEmpty();
    }

    @Test
    void trustStoreWithWrongPassword() {
        var generated = CertificateGenerator.trustStore(SELF_SIGNED, CertificateGenerator.JKS, "changeit");
        TrustStore store = new TrustStore(generated.path().toString(), new InlinePassword(UUID.randomUUID().toString()), generated.type());
        assertThatThrownBy(() -> TlsHttpClientConfigurator.trustManagersFor(store))
                .isInstanceOf(SslConfigurationException.class)
                .cause().isInstanceOf(IOException.class);
    }

    @Test
    void loadsClientKeyStore() {
        var generated = CertificateGenerator.keyStore(KEY_PAIR, SELF_SIGNED, "storepass", "keypass");
        KeyStore store = new KeyStore(generated.path().toString(), new InlinePassword("storepass"), new InlinePassword("keypass"), generated.type());
        KeyManager[] keyManagers = TlsHttpClientConfigurator.keyManagersFor(store);
        assertThat(keyManagers).isNotEmpty();
    }

    @Test
    void keyPasswordDefaultsToStorePassword() {
        var generated = CertificateGenerator.keyStore(KEY_PAIR, SELF_SIGNED, "password", "password");
        KeyStore store = new KeyStore(generated.path().toString(), new InlinePassword("password"), null, generated.type());
        assertThat(TlsHttpClientConfigurator.keyManagersFor(store)).isNotEmpty();
    }

    @Test
    void clientKeyStoreAppliedToContext() {
        var generated = CertificateGenerator.keyStore(KEY_PAIR, SELF_SIGNED, "password", "password");
        KeyStore store = new KeyStore(generated.path().toString(), new InlinePassword("password"), null, generated.type());
        var configurator = new TlsHttpClientConfigurator(new Tls(store, null, null, null));
        assertThat(configurator.sslContext().getProtocol()).isEqualTo("TLS");
    }

    @Test
    void managersAbsentWithoutConfiguration() {
        var configurator = new TlsHttpClientConfigurator(new Tls(null, null, null, null));
        assertThat(configurator.trustManagers()).isNull();
        assertThat(configurator.keyManagers()).isNull();
        assertThat(new TlsHttpClientConfigurator(null).trustManagers()).isNull();
    }

    @Test
    void managersExposedForOtherHttpStacks() {
        var generated = CertificateGenerator.keyStore(KEY_PAIR, SELF_SIGNED, "password", "password");
        KeyStore store = new KeyStore(generated.path().toString(), new InlinePassword("password"), null, generated.type());
        var configurator = new TlsHttpClientConfigurator(new Tls(store, new InsecureTls(true), null, null));
        assertThat(configurator.keyManagers()).isNotEmpty();
        assertThat(configurator.trustManagers()).singleElement().isInstanceOf(InsecureTrustManager.class);
    }

    @Test
    void unknownDeniedProtocolIsIgnored() {
        new TlsHttpClientConfigurator(new Tls(null, null, null, new AllowDeny<>(null, Set.of("UNKNOWN_PROTOCOL")))).apply(builder);
        assertThat(builder.build().sslParameters().getProtocols()).isNotEmpty();
    }

    @Test
    void restrictsProtocolsToAllowedList() {
        new TlsHttpClientConfigurator(new Tls(null, null, null, new AllowDeny<>(List.of(TLS_V1_3), null))).apply(builder);
        assertThat(builder.build().sslParameters().getProtocols()).containsExactly(TLS_V1_3);
    }

    @Test
    void deniedProtocolsAreRemoved() {
        new TlsHttpClientConfigurator(new Tls(null, null, null, new AllowDeny<>(null, Set.of(TLS_V1_2)))).apply(builder);
        assertThat(builder.build().sslParameters().getProtocols()).doesNotContain(TLS_V1_2);
    }

    @Test
    void unknownProtocolsAreIgnored() {
        new TlsHttpClientConfigurator(new Tls(null, null, null, new AllowDeny<>(List.of(TLS_V1_3, "UNKNOWN_PROTOCOL"), null))).apply(builder);
        assertThat(builder.build().sslParameters().getProtocols()).containsExactly(TLS_V1_3);
    }

    @Test
    void detectsNoEnabledProtocols() {
        var configurator = new TlsHttpClientConfigurator(new Tls(null, null, null, new AllowDeny<>(List.of(TLS_V1_3), Set.of(TLS_V1_3))));
        assertThatThrownBy(() -> configurator.apply(builder))
                .isInstanceOf(SslConfigurationException.class)
                .hasMessageContaining("no protocols");
    }

    @Test
    void detectsNoEnabledCipherSuites() throws NoSuchAlgorithmException {
        String suite = SSLContext.getDefault().getDefaultSSLParameters().getCipherSuites()[0];
        var configurator = new TlsHttpClientConfigurator(new Tls(null, null, new AllowDeny<>(List.of(suite), Set.of(suite)), null));
        assertThatThrownBy(() -> configurator.apply(builder))
                .isInstanceOf(SslConfigurationException.class)
                .hasMessageContaining("no cipher suites");
    }
}
