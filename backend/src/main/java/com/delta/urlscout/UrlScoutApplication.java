package com.delta.urlscout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UrlScoutApplication {

  public static void main(String[] args) {
    SpringApplication.run(UrlScoutApplication.class, args);
  }
}
