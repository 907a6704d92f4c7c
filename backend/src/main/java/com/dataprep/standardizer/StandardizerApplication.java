package com.dataprep.standardizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StandardizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(StandardizerApplication.class, args);
  }
}
