package com.fintech.resolution.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class ErrorResponse {

    String code;
    String message;
    Map<String, Object> details;
    Instant timestamp;
}
