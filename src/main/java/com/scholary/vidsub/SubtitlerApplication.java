package com.scholary.vidsub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SubtitlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SubtitlerApplication.class, args);
  }
}
