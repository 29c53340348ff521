package com.architectai.generation.controller;

import com.architectai.generation.config.VersionStoreInitializer;
import com.architectai.generation.service.JobRegistry;
import com.architectai.generation.service.NotificationHub;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final VersionStoreInitializer initializer;
    private final JobRegistry jobRegistry;
    private final NotificationHub notificationHub;
    private final String serviceName;

    public HealthController(VersionStoreInitializer initializer,
                            JobRegistry jobRegistry,
                            NotificationHub notificationHub,
                            @Value("${spring.application.name:artifact-generation-service}") String serviceName) {
        this.initializer = initializer;
        this.jobRegistry = jobRegistry;
        this.notificationHub = notificationHub;
        this.serviceName = serviceName;
    }

    @Operation(summary = "Service health", description = "Returns 503 until version histories have been loaded.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ready = initializer.isReady();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "healthy" : "starting");
        body.put("ready", ready);
        body.put("service", serviceName);
        body.put("active_jobs", jobRegistry.countActive());
        body.put("connections", notificationHub.connectionCount());
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
