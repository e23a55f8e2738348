package io.github.drompincen.complianceboard.gateway.controller;

import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/** Maps service outcomes to HTTP: success is 200, a known not-found error is 404, anything else 400. */
final class ApiResponses {

    private ApiResponses() {}

    static ResponseEntity<?> of(ApiResult<?> result) {
        return of(result, null);
    }

    static ResponseEntity<?> of(ApiResult<?> result, String notFoundError) {
        if (result.success()) return ResponseEntity.ok(result.value());
        if (notFoundError != null && notFoundError.equals(result.error())) {
            return ResponseEntity.status(404).body(error(result.error()));
        }
        return ResponseEntity.badRequest().body(error(result.error()));
    }

    static Map<String, String> error(String message) {
        return Map.of("error", message != null ? message : "Request failed");
    }
}
