package com.github.spud.primus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrimusPolicyApplication {

  public static void main(String[] args) {
    SpringApplication.run(PrimusPolicyApplication.class, args);
  }

}
