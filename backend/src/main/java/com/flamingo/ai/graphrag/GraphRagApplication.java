package com.flamingo.ai.graphrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Main application class for the graph-augmented retrieval service. */
@SpringBootApplication
public class GraphRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(GraphRagApplication.class, args);
  }
}
