package com.chanmux.gateway.http;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class HealthController {

    private static final List<String> ENDPOINTS = List.of(
        "POST /channels",
        "GET /channels",
        "GET /channels/{channelId}/status",
        "POST /channels/{channelId}/qrcode",
        "GET /channels/{channelId}/health",
        "DELETE /channels/{channelId}",
        "POST /messages/text",
        "POST /messages/check-number",
        "GET /health"
    );

    @GetMapping("/")
    public ApiResponse<Map<String, Object>> info() {
        var info = new LinkedHashMap<String, Object>();
        info.put("name", "ChanMux");
        info.put("description", "Multi-channel messaging connection gateway");
        info.put("endpoints", ENDPOINTS);
        return ApiResponse.ok(info);
    }

    @GetMapping("/health")
    public ApiResponse<Map<String, Object>> health() {
        var runtime = Runtime.getRuntime();
        var memory = new LinkedHashMap<String, Object>();
        memory.put("total", runtime.totalMemory());
        memory.put("free", runtime.freeMemory());
        memory.put("max", runtime.maxMemory());

        var health = new LinkedHashMap<String, Object>();
        health.put("status", "OK");
        health.put("uptimeSeconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        health.put("memory", memory);
        health.put("timestamp", Instant.now().toString());
        health.put("javaVersion", System.getProperty("java.version"));
        return ApiResponse.ok(health);
    }
}
