package com.scholary.scribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AiScribeApplication {

  public static void main(String[] args) {
    SpringApplication.run(AiScribeApplication.class, args);
  }
}
