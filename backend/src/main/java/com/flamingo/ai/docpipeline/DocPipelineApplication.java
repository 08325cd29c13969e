package com.flamingo.ai.docpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Document summarization pipeline service. */
@SpringBootApplication
public class DocPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocPipelineApplication.class, args);
  }
}
