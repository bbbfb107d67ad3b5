package com.signaldesk.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.ArrayList;
import java.util.List;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(PipelineApplication.class, expandShorthands(args));
  }

  // --once, --job=<name>, --dev and --debug into their property form
  static String[] expandShorthands(String[] args) {
    List<String> expanded = new ArrayList<>();
    for (String arg : args) {
      if ("--once".equals(arg)) {
        expanded.add("--pipeline.cli.mode=once");
      } else if (arg.startsWith("--job=")) {
        expanded.add("--pipeline.cli.mode=job");
        expanded.add("--pipeline.cli.job=" + arg.substring("--job=".length()));
      } else if ("--dev".equals(arg)) {
        expanded.add("--pipeline.demo-mode=true");
      } else if ("--debug".equals(arg)) {
        expanded.add("--logging.level.com.signaldesk.pipeline=DEBUG");
      } else {
        expanded.add(arg);
      }
    }
    return expanded.toArray(new String[0]);
  }
}
