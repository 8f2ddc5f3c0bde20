package com.healthsync.vitals.controller;

import com.healthsync.vitals.security.JwtIssuerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/dev/auth")
@Profile("!prod") // any non-prod profile (default, local, test)
public class DevAuthController {
    private static final Logger log = LoggerFactory.getLogger(DevAuthController.class);
    static final String DEFAULT_EMAIL = "demo@healthsync.local";
    static final long TOKEN_TTL_SECONDS = 3600;

    private final JwtIssuerService issuerService;

    public DevAuthController(JwtIssuerService issuerService) {
        this.issuerService = issuerService;
    }

    public record LoginRequest(String email) {}
    public record LoginResponse(String token, String email, long expiresInSeconds) {}

    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody(required = false) LoginRequest body) {
        if (!issuerService.isEnabled()) {
            return ResponseEntity.status(404).body(Map.of("error", "dev auth disabled"));
        }
        String email = body != null && body.email() != null && !body.email().isBlank()
                ? body.email().trim()
                : DEFAULT_EMAIL;
        if (!email.contains("@")) {
            throw new IllegalArgumentException("email must be an e-mail address");
        }
        log.debug("[dev-auth] issuing dev token");
        String token = issuerService.issue(email, TOKEN_TTL_SECONDS);
        return ResponseEntity.ok(new LoginResponse(token, email, TOKEN_TTL_SECONDS));
    }
}
