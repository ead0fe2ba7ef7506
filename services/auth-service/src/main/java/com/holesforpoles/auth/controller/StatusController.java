package com.holesforpoles.auth.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness endpoints for load balancers and humans.
 */
@RestController
public class StatusController {

    private final Clock clock;
    private final String appName;
    private final String version;

    public StatusController(Clock clock,
                            @Value("${app.name:Holes For Poles}") String appName,
                            @Value("${app.version:0.1.0}") String version) {
        this.clock = clock;
        this.appName = appName;
        this.version = version;
    }

    /**
     * Welcome banner.
     *
     * @return message, status "online" and where the documentation lives
     */
    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Welcome to " + appName + "!");
        body.put("status", "online");
        body.put("documentation", "/actuator");
        return body;
    }

    /**
     * Liveness check. Never touches the database.
     *
     * @return status "operational", the current local time and the app version
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "operational");
        body.put("timestamp", LocalDateTime.now(clock).toString());
        body.put("version", version);
        return body;
    }
}
