package com.evoila.tenantplugin.security.config;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Accepts or rejects the raw {@code Authorization} header of a generator call. The only accepted
 * value is {@code "Bearer " + expectedToken}, compared in constant time.
 */
public class PluginTokenAuthenticator {

  static final String BEARER_PREFIX = "Bearer ";

  private final byte[] expectedHeader;

  public PluginTokenAuthenticator(String expectedToken) {
    if (expectedToken == null || expectedToken.isEmpty()) {
      throw new IllegalArgumentException("Expected token must not be empty");
    }
    this.expectedHeader = (BEARER_PREFIX + expectedToken).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * @param authorizationHeader header value as received, may be null
   * @return true only for an exact match of scheme and token
   */
  public boolean authenticate(String authorizationHeader) {
    if (authorizationHeader == null) {
      return false;
    }
    byte[] presented = authorizationHeader.getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expectedHeader, presented);
  }
}
