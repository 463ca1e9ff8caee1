package com.janus.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        String version = HealthController.class.getPackage().getImplementationVersion();
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "version", version != null ? version : "dev"
        ));
    }
}
