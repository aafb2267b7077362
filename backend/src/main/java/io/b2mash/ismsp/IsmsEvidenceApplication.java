package io.b2mash.ismsp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IsmsEvidenceApplication {

  public static void main(String[] args) {
    SpringApplication.run(IsmsEvidenceApplication.class, args);
  }
}
