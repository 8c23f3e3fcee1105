package org.h2ox.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReservoirApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReservoirApiApplication.class, args);
  }
}
