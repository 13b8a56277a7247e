package com.spreadsheet.formula;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Starts the formula engine.
 * With command-line arguments it runs as a batch job over the named input file and exits;
 * without any it serves the HTTP API.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SpreadsheetApplication {

    public static void main(String[] args) {
        boolean batch = args.length > 0;
        ConfigurableApplicationContext context = new SpringApplicationBuilder(SpreadsheetApplication.class)
                .web(batch ? WebApplicationType.NONE : WebApplicationType.SERVLET)
                .run(args);
        if (batch) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
