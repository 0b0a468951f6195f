package com.example.pos.common;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.Map;

@RestController
public class ApiController {

    private static final String KEY_STATUS = "status";
    private static final String KEY_VERSION = "version";
    private static final String KEY_TIMESTAMP = "timestamp";
    private static final String VERSION_VALUE = "1.0.0";

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                KEY_STATUS, "healthy",
                KEY_TIMESTAMP, OffsetDateTime.now().toString(),
                KEY_VERSION, VERSION_VALUE);
    }
}
