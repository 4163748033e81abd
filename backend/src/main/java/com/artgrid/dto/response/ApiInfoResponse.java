package com.artgrid.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiInfoResponse {

    private String message;

    private String version;

    private Map<String, String> endpoints;
}
