package com.todoapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Todo API Server Application
 *
 * Multi-user task tracking REST API built with Spring Boot WebFlux
 * and reactive PostgreSQL access.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TodoApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TodoApiApplication.class, args);
    }

}
