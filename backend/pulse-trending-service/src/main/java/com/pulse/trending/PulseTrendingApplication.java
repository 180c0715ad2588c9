package com.pulse.trending;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PulseTrendingApplication {
  public static void main(String[] args) {
    SpringApplication.run(PulseTrendingApplication.class, args);
  }
}
