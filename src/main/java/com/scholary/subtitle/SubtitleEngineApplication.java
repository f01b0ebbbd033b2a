package com.scholary.subtitle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SubtitleEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(SubtitleEngineApplication.class, args);
  }
}
