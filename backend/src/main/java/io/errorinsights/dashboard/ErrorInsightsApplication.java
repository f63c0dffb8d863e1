package io.errorinsights.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ErrorInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ErrorInsightsApplication.class, args);
    }
}
