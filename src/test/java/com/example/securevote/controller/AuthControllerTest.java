package com.example.securevote.controller;

import com.example.securevote.security.JwtTokenProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthController.
 */
@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private AuthenticationManager authenticationManager;

    @Mock
    private JwtTokenProvider tokenProvider;

    @InjectMocks
    private AuthController authController;

    @Test
    void testLoginReturnsTokenAndPlainRoleNames() {
        Authentication auditor = new UsernamePasswordAuthenticationToken("auditor", null,
            List.of(new SimpleGrantedAuthority("ROLE_AUDITOR")));
        when(authenticationManager.authenticate(any())).thenReturn(auditor);
        when(tokenProvider.generateToken(auditor)).thenReturn("jwt");
        when(tokenProvider.getExpirationMillis()).thenReturn(3_600_000L);

        ResponseEntity<Map<String, Object>> response = authController.login(login(" auditor ", "auditor123"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("jwt", response.getBody().get("token"));
        assertEquals("auditor", response.getBody().get("operator"));
        assertEquals(List.of("AUDITOR"), response.getBody().get("roles"));
        assertEquals(3_600_000L, response.getBody().get("expiresInMs"));
        verify(authenticationManager).authenticate(new UsernamePasswordAuthenticationToken("auditor", "auditor123"));
    }

    @Test
    void testBlankCredentialsRejectedBeforeAuthenticating() {
        assertEquals(HttpStatus.BAD_REQUEST, authController.login(null).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, authController.login(login("  ", "secret")).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, authController.login(login("admin", "")).getStatusCode());

        ResponseEntity<Map<String, Object>> missingPassword = authController.login(login("admin", null));
        assertEquals("MALFORMED_REQUEST", missingPassword.getBody().get("error"));
        verifyNoInteractions(authenticationManager, tokenProvider);
    }

    @Test
    void testBadCredentialsAreUnauthorized() {
        when(authenticationManager.authenticate(any())).thenThrow(new BadCredentialsException("bad"));

        ResponseEntity<Map<String, Object>> response = authController.login(login("admin", "wrong"));

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        assertEquals("BAD_CREDENTIALS", response.getBody().get("error"));
        verify(tokenProvider, never()).generateToken(any());
    }

    @Test
    void testCurrentOperator() {
        assertEquals(HttpStatus.UNAUTHORIZED, authController.currentOperator(null).getStatusCode());

        Authentication admin = new UsernamePasswordAuthenticationToken("admin", null,
            List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
        Map<String, Object> body = authController.currentOperator(admin).getBody();
        assertEquals("admin", body.get("operator"));
        assertEquals(List.of("ADMIN"), body.get("roles"));
    }

    private static AuthController.OperatorLogin login(String username, String password) {
        AuthController.OperatorLogin login = new AuthController.OperatorLogin();
        login.setUsername(username);
        login.setPassword(password);
        return login;
    }
}
