package com.flamingo.ai.wikishred;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the wiki shredding and chunking service. */
@SpringBootApplication
public class WikiShredApplication {

  public static void main(String[] args) {
    SpringApplication.run(WikiShredApplication.class, args);
  }
}
