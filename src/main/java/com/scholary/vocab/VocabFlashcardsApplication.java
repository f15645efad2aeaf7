package com.scholary.vocab;

import com.scholary.vocab.cli.VocabCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VocabFlashcardsApplication {

  public static void main(String[] args) {
    SpringApplication application = new SpringApplication(VocabFlashcardsApplication.class);
    if (VocabCommandLineRunner.isCommandLineRun(args)) {
      application.setWebApplicationType(WebApplicationType.NONE);
      System.exit(SpringApplication.exit(application.run(args)));
    }
    application.run(args);
  }
}
