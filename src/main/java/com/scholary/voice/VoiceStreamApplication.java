package com.scholary.voice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class VoiceStreamApplication {

  public static void main(String[] args) {
    SpringApplication.run(VoiceStreamApplication.class, args);
  }
}
