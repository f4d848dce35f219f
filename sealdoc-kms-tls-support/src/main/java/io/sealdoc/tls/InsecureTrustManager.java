/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tls;

import java.security.cert.X509Certificate;

import javax.net.ssl.X509TrustManager;

/**
 * Insecure trust manager that does no certificate checking.  Typically
 * used against development backends.  Should not be used in production.
 */
class InsecureTrustManager implements X509TrustManager {

    @SuppressWarnings("java:S4830")
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
        // trusts everything; the api is to throw if not trusted
    }

    @SuppressWarnings("java:S4830")
    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
        // trusts everything; the api is to throw if not trusted
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }
}
