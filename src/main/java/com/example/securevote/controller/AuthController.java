package com.example.securevote.controller;

import com.example.securevote.security.JwtTokenProvider;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JWT login for election operators and auditors. Voters never log in here; they present
 * identity and ballot tokens to the voting endpoints.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthenticationManager authenticationManager;
    private final JwtTokenProvider tokenProvider;

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@RequestBody(required = false) OperatorLogin login) {
        if (login == null || !login.isComplete()) {
            return ApiResponses.badRequest("username and password are required");
        }

        Authentication operator;
        try {
            operator = authenticationManager.authenticate(
                new UsernamePasswordAuthenticationToken(login.getUsername().trim(), login.getPassword()));
        } catch (AuthenticationException e) {
            log.warn("Rejected operator login for {}", login.getUsername().trim());
            Map<String, Object> response = new HashMap<>();
            response.put("success", false);
            response.put("error", "BAD_CREDENTIALS");
            response.put("message", "Invalid username or password");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("token", tokenProvider.generateToken(operator));
        response.put("expiresInMs", tokenProvider.getExpirationMillis());
        response.put("operator", operator.getName());
        response.put("roles", roleNames(operator));
        log.info("Operator {} logged in with roles {}", operator.getName(), roleNames(operator));
        return ApiResponses.ok(response);
    }

    @GetMapping("/me")
    public ResponseEntity<Map<String, Object>> currentOperator(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ApiResponses.ok(Map.of("operator", authentication.getName(), "roles", roleNames(authentication)));
    }

    /**
     * Role names without Spring's {@code ROLE_} prefix, e.g. {@code ADMIN}, {@code AUDITOR}.
     */
    private static List<String> roleNames(Authentication authentication) {
        return authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .map(authority -> authority.startsWith("ROLE_") ? authority.substring(5) : authority)
            .collect(Collectors.toList());
    }

    @Data
    public static class OperatorLogin {
        private String username;
        private String password;

        boolean isComplete() {
            return username != null && !username.isBlank() && password != null && !password.isEmpty();
        }
    }
}
