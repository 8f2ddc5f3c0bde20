package com.healthsync.vitals.health;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness endpoint for load balancers; Actuator stays internal.
 */
@RestController
public class HealthzController {

    private final String serviceName;

    public HealthzController(@Value("${spring.application.name:vitals-svc}") String serviceName) {
        this.serviceName = serviceName;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of("status", "UP", "service", serviceName);
    }
}
