package com.ingestmanager.ingestmanager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class IngestManagerApplication {

    public static void main(String[] args) {
        boolean once = Arrays.asList(args).contains("--once");
        SpringApplication application = new SpringApplication(IngestManagerApplication.class);
        if (once) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = application.run(args);
        if (once) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
