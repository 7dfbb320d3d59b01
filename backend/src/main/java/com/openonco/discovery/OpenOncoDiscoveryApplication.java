package com.openonco.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OpenOncoDiscoveryApplication {

  public static void main(String[] args) {
    SpringApplication.run(OpenOncoDiscoveryApplication.class, args);
  }
}
