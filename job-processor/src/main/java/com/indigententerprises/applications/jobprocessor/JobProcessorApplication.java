package com.indigententerprises.applications.jobprocessor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.indigententerprises.applications.pipeline.repositories")
@EntityScan("com.indigententerprises.applications.pipeline.domain")
public class JobProcessorApplication {

    public static void main(final String[] args) {
        SpringApplication.run(JobProcessorApplication.class, args);
    }
}
