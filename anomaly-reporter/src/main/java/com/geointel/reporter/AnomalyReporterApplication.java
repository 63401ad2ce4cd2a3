package com.geointel.reporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class AnomalyReporterApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(AnomalyReporterApplication.class, args);
        if (context.getEnvironment().getProperty("reporter.scheduling.one-shot", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
