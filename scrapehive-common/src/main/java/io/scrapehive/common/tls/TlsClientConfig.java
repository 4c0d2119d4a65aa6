package io.scrapehive.common.tls;

import com.typesafe.config.Config;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.Socket;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Client side TLS options: an optional CA bundle, an optional client certificate/key pair and
 * a switch that disables chain and host verification.
 * <p>
 * Empty strings mean "not set", matching how the options appear in HOCON files.
 */
public record TlsClientConfig(String caPath, String certPath, String keyPath, boolean insecureSkipVerify) {

    public static final String CA_KEY = "ca";
    public static final String CERT_KEY = "cert";
    public static final String KEY_KEY = "key";
    public static final String INSECURE_SKIP_VERIFY_KEY = "insecure_skip_verify";

    private static final char[] NO_PASSWORD = new char[0];

    public TlsClientConfig {
        caPath = caPath == null ? "" : caPath.trim();
        certPath = certPath == null ? "" : certPath.trim();
        keyPath = keyPath == null ? "" : keyPath.trim();
    }

    public static TlsClientConfig none() {
        return new TlsClientConfig("", "", "", false);
    }

    public static TlsClientConfig fromConfig(Config config) {
        return new TlsClientConfig(
                config.hasPath(CA_KEY) ? config.getString(CA_KEY) : "",
                config.hasPath(CERT_KEY) ? config.getString(CERT_KEY) : "",
                config.hasPath(KEY_KEY) ? config.getString(KEY_KEY) : "",
                config.hasPath(INSECURE_SKIP_VERIFY_KEY) && config.getBoolean(INSECURE_SKIP_VERIFY_KEY));
    }

    public boolean isEmpty() {
        return caPath.isEmpty() && certPath.isEmpty() && keyPath.isEmpty() && !insecureSkipVerify;
    }

    /**
     * Builds the {@link SSLContext} described by these options. With nothing configured the JVM
     * default context is returned.
     */
    public SSLContext createSslContext() throws TlsConfigurationException {
        if (certPath.isEmpty() != keyPath.isEmpty()) {
            throw new TlsConfigurationException("tls cert and tls key must be configured together");
        }
        try {
            if (isEmpty()) {
                return SSLContext.getDefault();
            }
            KeyManager[] keyManagers = certPath.isEmpty() ? null : keyManagers();
            TrustManager[] trustManagers;
            if (insecureSkipVerify) {
                trustManagers = new TrustManager[]{new TrustAllManager()};
            } else if (!caPath.isEmpty()) {
                trustManagers = trustManagers();
            } else {
                trustManagers = null;
            }
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keyManagers, trustManagers, null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new TlsConfigurationException("could not load TLS configuration: " + e.getMessage(), e);
        }
    }

    private KeyManager[] keyManagers() throws IOException, GeneralSecurityException {
        List<X509Certificate> chain = PemReader.readCertificates(Path.of(certPath));
        PrivateKey key = PemReader.readPrivateKey(Path.of(keyPath));

        KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
        store.load(null, null);
        store.setKeyEntry("client", key, NO_PASSWORD, chain.toArray(new X509Certificate[0]));

        KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        factory.init(store, NO_PASSWORD);
        return factory.getKeyManagers();
    }

    private TrustManager[] trustManagers() throws IOException, GeneralSecurityException {
        KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
        store.load(null, null);
        int i = 0;
        for (X509Certificate certificate : PemReader.readCertificates(Path.of(caPath))) {
            store.setCertificateEntry("ca-" + i++, certificate);
        }
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(store);
        return factory.getTrustManagers();
    }

    // Accepts every chain. Being an X509ExtendedTrustManager it also skips endpoint identification.
    private static final class TrustAllManager extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
