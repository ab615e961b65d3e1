package com.scholary.synthjobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SynthJobsApplication {

  public static void main(String[] args) {
    SpringApplication.run(SynthJobsApplication.class, args);
  }
}
