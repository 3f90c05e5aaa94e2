package com.ospicorp.tsdb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TsdbApplication {

  public static void main(String[] args) {
    SpringApplication.run(TsdbApplication.class, args);
  }
}
