package it.ldap.security;

import java.io.InputStream;
import java.security.KeyStore;
import java.security.cert.CertPathValidator;
import java.security.cert.PKIXBuilderParameters;
import java.security.cert.PKIXRevocationChecker;
import java.security.cert.X509CertSelector;
import java.util.Locale;
import java.util.Set;

import javax.net.ssl.CertPathTrustManagerParameters;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Client-side TLS context for LDAPS connections.
 */
@Component
public class TLSContextFactory {

    private final ResourceLoader resourceLoader;

    public TLSContextFactory(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Without a trust store the JVM default trust managers are used.
     */
    public SSLContext create(String trustStorePath, String trustStorePassword, boolean revocationEnabled) {
        try {
            TrustManagerFactory tmf = null;
            if (StringUtils.hasText(trustStorePath)) {
                KeyStore trustStore = loadStore(trustStorePath, trustStorePassword);
                tmf = TrustManagerFactory.getInstance("PKIX");
                PKIXBuilderParameters parameters = new PKIXBuilderParameters(trustStore, new X509CertSelector());
                parameters.setRevocationEnabled(revocationEnabled);

                if (revocationEnabled) {
                    PKIXRevocationChecker checker = (PKIXRevocationChecker) CertPathValidator.getInstance("PKIX").getRevocationChecker();
                    checker.setOptions(Set.of(PKIXRevocationChecker.Option.PREFER_CRLS));
                    parameters.addCertPathChecker(checker);
                }

                tmf.init(new CertPathTrustManagerParameters(parameters));
            }

            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, tmf == null ? null : tmf.getTrustManagers(), null);
            return ctx;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize LDAPS TLS context", e);
        }
    }

    private KeyStore loadStore(String path, String password) throws Exception {
        Resource resource = resourceLoader.getResource(path);
        String type = path.toLowerCase(Locale.ROOT).endsWith(".jks") ? "JKS" : "PKCS12";
        try (InputStream is = resource.getInputStream()) {
            KeyStore keyStore = KeyStore.getInstance(type);
            keyStore.load(is, StringUtils.hasText(password) ? password.toCharArray() : null);
            return keyStore;
        }
    }
}
