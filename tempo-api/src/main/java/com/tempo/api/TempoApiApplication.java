package com.tempo.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.tempo")
@EnableJpaRepositories(basePackages = "com.tempo")
@EntityScan(basePackages = "com.tempo")
@ConfigurationPropertiesScan(basePackages = "com.tempo")
public class TempoApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(TempoApiApplication.class, args);
  }
}
