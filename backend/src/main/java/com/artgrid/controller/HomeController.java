package com.artgrid.controller;

import com.artgrid.dto.response.ApiInfoResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HomeController {

    static final String API_VERSION = "1.0.0";

    @GetMapping("/")
    public ResponseEntity<ApiInfoResponse> home() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("auth/register", "POST");
        endpoints.put("auth/login", "POST");
        endpoints.put("artworks", "GET");
        endpoints.put("artworks/upload", "POST");
        endpoints.put("comments", "POST");
        endpoints.put("admin/queue", "GET");

        return ResponseEntity.ok(new ApiInfoResponse("ARTGRID API is live", API_VERSION, endpoints));
    }
}
