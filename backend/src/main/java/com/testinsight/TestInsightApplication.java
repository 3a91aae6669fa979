package com.testinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TestInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(TestInsightApplication.class, args);
    }
}
