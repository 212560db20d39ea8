package com.architecture.flowforge;

import com.architecture.flowforge.cli.ConversionCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * FlowForge - converts draw.io (diagrams.net) documents to Mermaid flowcharts.
 *
 * Runs as a REST service by default. When {@code flowforge.cli.input} is set the command-line
 * runner converts that file and the process exits with the runner's exit code.
 */
@SpringBootApplication
public class FlowForgeApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(FlowForgeApplication.class, args);
        if (!context.getBeansOfType(ConversionCommandLineRunner.class).isEmpty()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
