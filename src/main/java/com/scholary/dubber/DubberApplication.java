package com.scholary.dubber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DubberApplication {

  public static void main(String[] args) {
    SpringApplication.run(DubberApplication.class, args);
  }
}
