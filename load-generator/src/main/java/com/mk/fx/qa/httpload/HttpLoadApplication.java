package com.mk.fx.qa.httpload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HttpLoadApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(HttpLoadApplication.class, args)));
  }
}
