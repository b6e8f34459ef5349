package com.alertrelay.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class HttpClientFactory {
    static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER);
        truststore(environment).map(HttpClientFactory::sslContext).ifPresent(builder::sslContext);
        return builder.build();
    }

    static Optional<Truststore> truststore(Map<String, String> environment) {
        String location = environment.get(TRUSTSTORE_PATH);
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(TRUSTSTORE_PASSWORD);
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        return Optional.of(new Truststore(path, password.toCharArray(), typeOf(path)));
    }

    private static SSLContext sslContext(Truststore truststore) {
        try (InputStream in = Files.newInputStream(truststore.path())) {
            KeyStore keyStore = KeyStore.getInstance(truststore.type());
            keyStore.load(in, truststore.password());

            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(keyStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), new SecureRandom());
            return context;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + truststore.path(), e);
        }
    }

    private static String typeOf(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".p12") || name.endsWith(".pfx") || name.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }

    record Truststore(Path path, char[] password, String type) {
    }
}
