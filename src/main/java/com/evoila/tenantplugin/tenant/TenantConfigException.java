package com.evoila.tenantplugin.tenant;

/** Failure to read or decode tenant configuration while serving a request. */
public class TenantConfigException extends RuntimeException {

  public TenantConfigException(String message) {
    super(message);
  }

  public TenantConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
