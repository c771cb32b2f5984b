package com.todoapi.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Service info endpoint. Liveness is reported by the actuator health endpoint.
 */
@RestController
@RequestMapping
public class HealthController {

    static final String VERSION = "1.0.0";

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "message", "Welcome to the Todo API",
            "version", VERSION,
            "health", "/actuator/health"
        ));
    }
}
