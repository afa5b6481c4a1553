package com.example.securevote.controller;

import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared response bodies: {@code {success:true, ...}} or {@code {success:false, error, message}}.
 */
final class ApiResponses {
    private ApiResponses() {}

    static ResponseEntity<Map<String, Object>> ok(Map<String, Object> body) {
        Map<String, Object> response = new HashMap<>(body);
        response.put("success", true);
        return ResponseEntity.ok(response);
    }

    static ResponseEntity<Map<String, Object>> error(VoteError error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", error.name());
        response.put("message", message != null ? message : error.getDefaultMessage());
        if (error.isRetryable()) {
            response.put("retryable", true);
        }
        return ResponseEntity.status(error.getHttpStatus()).body(response);
    }

    static ResponseEntity<Map<String, Object>> error(Result<?> failed) {
        return error(failed.getError().orElseThrow(), failed.getMessage());
    }

    static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return error(VoteError.MALFORMED_REQUEST, message);
    }
}
