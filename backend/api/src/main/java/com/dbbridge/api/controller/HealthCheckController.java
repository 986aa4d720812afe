package com.dbbridge.api.controller;

import com.dbbridge.api.registry.ConnectionRegistry;
import com.dbbridge.api.strategy.BackendStrategy;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ClassUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthCheckController {

    private final ConnectionRegistry connectionRegistry;
    private final List<BackendStrategy> strategies;

    @GetMapping("/health")
    public String healthCheck() {
        return "OK";
    }

    @GetMapping("/health/connections")
    public Map<String, Object> connectionHealthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("openConnections", connectionRegistry.size());

        Map<String, Object> drivers = new HashMap<>();
        for (BackendStrategy strategy : strategies) {
            boolean present = ClassUtils.isPresent(strategy.getDriverClassName(), getClass().getClassLoader());
            if (!present) {
                log.warn("JDBC driver {} for {} is not on the classpath",
                        strategy.getDriverClassName(), strategy.getBackendKind().getId());
            }
            drivers.put(
                strategy.getBackendKind().getId(),
                Map.of("status", present ? "UP" : "DOWN", "driver", strategy.getDriverClassName())
            );
        }
        health.put("backends", drivers);
        return health;
    }
}
