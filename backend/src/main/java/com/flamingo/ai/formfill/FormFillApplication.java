package com.flamingo.ai.formfill;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the form fill backend. */
@SpringBootApplication
public class FormFillApplication {

  public static void main(String[] args) {
    SpringApplication.run(FormFillApplication.class, args);
  }
}
