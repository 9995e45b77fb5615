package com.delta.propertytracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PropertyTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(PropertyTrackerApplication.class, args);
  }
}
