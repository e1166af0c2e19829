package com.acme.procmine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProcmineApplication {
  public static void main(String[] args) {
    SpringApplication.run(ProcmineApplication.class, args);
  }
}
