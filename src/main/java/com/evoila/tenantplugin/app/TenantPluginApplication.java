package com.evoila.tenantplugin.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.evoila.tenantplugin")
@ConfigurationPropertiesScan("com.evoila.tenantplugin.common.config")
public class TenantPluginApplication {

  public static void main(String[] args) {
    SpringApplication.run(TenantPluginApplication.class, args);
  }
}
