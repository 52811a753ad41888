package com.company.searchindexer.controller;

import com.company.searchindexer.client.SearchIndexClient;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Tag(name = "Health")
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final SearchIndexClient searchIndexClient;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        boolean elasticsearch = searchIndexClient.ping();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", elasticsearch ? "UP" : "DEGRADED");
        body.put("elasticsearch", elasticsearch ? "UP" : "DOWN");
        return ResponseEntity.status(elasticsearch ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
