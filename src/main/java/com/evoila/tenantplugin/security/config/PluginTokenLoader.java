package com.evoila.tenantplugin.security.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Reads the shared bearer token that the delivery controller presents on every call. */
@UtilityClass
@Slf4j
public class PluginTokenLoader {

  /**
   * Reads the token file once and strips surrounding whitespace (secret mounts usually end with a
   * newline).
   *
   * @param tokenFile path of the mounted secret
   * @return the expected token, never blank
   * @throws IllegalStateException if the file is missing, unreadable or blank
   */
  public static String load(String tokenFile) {
    if (tokenFile == null || tokenFile.isBlank()) {
      throw new IllegalStateException("No plugin token file configured");
    }

    String token;
    try {
      token = Files.readString(Path.of(tokenFile)).trim();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read plugin token from " + tokenFile, e);
    }

    if (token.isEmpty()) {
      throw new IllegalStateException("Plugin token file " + tokenFile + " is empty");
    }
    log.info("Loaded plugin token from: {}", tokenFile);
    return token;
  }
}
