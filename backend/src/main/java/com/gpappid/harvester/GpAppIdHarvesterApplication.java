package com.gpappid.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GpAppIdHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(GpAppIdHarvesterApplication.class, args);
  }
}
