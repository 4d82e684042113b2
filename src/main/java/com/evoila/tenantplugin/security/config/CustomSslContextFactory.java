package com.evoila.tenantplugin.security.config;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility class for creating SSL contexts that trust only the root certificates of a single PEM
 * file. Used to secure the Keyspaces session; the JVM's default trust store is never consulted
 * and no client certificate is presented.
 */
@UtilityClass
@Slf4j
public class CustomSslContextFactory {

  private static final String TLS_PROTOCOL = "TLS";

  /**
   * Loads every certificate of a PEM bundle and creates a TrustManagerFactory from them.
   *
   * @param caPath Path to the root certificate file (PEM format, one or more certificates)
   * @return TrustManagerFactory configured with exactly those certificates
   * @throws Exception if the file cannot be read, holds no certificate, or cannot be parsed
   */
  public static TrustManagerFactory loadCustomCaTrustManager(Path caPath) throws Exception {
    log.info("Loading root certificates from: {}", caPath);

    CertificateFactory cf = CertificateFactory.getInstance("X.509");
    Collection<? extends Certificate> certificates;
    try (InputStream in = Files.newInputStream(caPath)) {
      certificates = cf.generateCertificates(in);
    }
    if (certificates.isEmpty()) {
      throw new GeneralSecurityException("No certificate found in " + caPath);
    }

    KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
    keyStore.load(null, null);
    int index = 0;
    for (Certificate certificate : certificates) {
      keyStore.setCertificateEntry("root-ca-" + index++, certificate);
    }

    TrustManagerFactory tmf =
        TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
    tmf.init(keyStore);

    log.info("TrustManager created with {} root certificate(s) from: {}", index, caPath);
    return tmf;
  }

  /**
   * Creates a client SSLContext trusting only the certificates found in the given file.
   *
   * @param caPath Path to the root certificate file (PEM format)
   * @return initialized SSLContext without key managers
   * @throws Exception if certificate loading or SSL configuration fails
   */
  public static SSLContext createSslContext(Path caPath) throws Exception {
    TrustManagerFactory tmf = loadCustomCaTrustManager(caPath);

    SSLContext sslContext = SSLContext.getInstance(TLS_PROTOCOL);
    sslContext.init(null, tmf.getTrustManagers(), null);
    return sslContext;
  }

  /**
   * Checks if a root certificate file exists and is accessible.
   *
   * @param caPath Path to the certificate file
   * @return true if the file exists and is readable, false otherwise
   */
  public static boolean isCustomCaAvailable(String caPath) {
    if (caPath == null || caPath.trim().isEmpty()) {
      return false;
    }

    Path path = Path.of(caPath);
    return Files.exists(path) && Files.isReadable(path);
  }
}
