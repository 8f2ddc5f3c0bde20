package com.healthsync.vitals.config;

import com.healthsync.vitals.security.JsonAuthErrorHandlers;
import com.healthsync.vitals.security.RequestContextHolder;
import com.healthsync.vitals.security.TraceIdFilter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtDecoders;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {
    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            TraceIdFilter traceIdFilter,
            JwtAuthenticationConverter jwtAuthenticationConverter,
            JsonAuthErrorHandlers jsonAuthErrorHandlers
    ) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(registry -> registry
                        .requestMatchers(HttpMethod.POST, "/dev/auth/login").permitAll()
                        .requestMatchers("/healthz").permitAll()
                        .requestMatchers("/actuator/health/liveness").permitAll()
                        .requestMatchers("/error").permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(handling -> handling
                        .authenticationEntryPoint(jsonAuthErrorHandlers)
                        .accessDeniedHandler(jsonAuthErrorHandlers)
                )
                .oauth2ResourceServer(resource -> resource
                        .authenticationEntryPoint(jsonAuthErrorHandlers)
                        .accessDeniedHandler(jsonAuthErrorHandlers)
                        .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter))
                );

        http.addFilterBefore(traceIdFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    JwtAuthenticationConverter jwtAuthenticationConverter(VitalsProperties properties) {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setPrincipalClaimName(properties.security().userClaim());
        converter.setJwtGrantedAuthoritiesConverter(jwt -> List.of());
        return converter;
    }

    @Bean
    public JwtDecoder jwtDecoder(VitalsProperties properties, Environment environment) {
        VitalsProperties.Security security = properties.security();
        if (security.hasIssuer()) {
            log.info("Security: using issuer {} audience {}", security.issuer(), security.audience());
            NimbusJwtDecoder decoder = (NimbusJwtDecoder) JwtDecoders.fromIssuerLocation(security.issuer());
            OAuth2TokenValidator<Jwt> validator = JwtValidators.createDefaultWithIssuer(security.issuer());
            if (security.hasAudience()) {
                validator = new DelegatingOAuth2TokenValidator<>(validator, audienceValidator(security.audience()));
            }
            decoder.setJwtValidator(validator);
            return decoder;
        }
        if (security.hasDevJwtSecret() && !environment.acceptsProfiles(Profiles.of("prod"))) {
            log.warn("Security: no issuer configured; using dev shared secret");
            return hmacDecoder(security.devJwtSecret().getBytes(StandardCharsets.UTF_8));
        }
        if (environment.acceptsProfiles(Profiles.of("test"))) {
            log.warn("Security: generating ephemeral test JWT secret (no issuer/dev secret provided)");
            byte[] random = UUID.randomUUID().toString().replace("-", "").getBytes(StandardCharsets.UTF_8);
            return hmacDecoder(random);
        }
        throw new IllegalStateException("No JWT issuer or dev secret configured (set VITALS_JWT_ISSUER or VITALS_DEV_JWT_SECRET)");
    }

    private JwtDecoder hmacDecoder(byte[] secret) {
        SecretKeySpec key = new SecretKeySpec(secret, "HmacSHA256");
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        // expiry is still enforced; issuer/audience are not meaningful for dev tokens
        decoder.setJwtValidator(JwtValidators.createDefault());
        return decoder;
    }

    private OAuth2TokenValidator<Jwt> audienceValidator(String audience) {
        List<String> allowed = List.of(audience.split(","))
                .stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return token -> {
            List<String> tokenAud = token.getAudience();
            if (tokenAud != null) {
                for (String a : tokenAud) {
                    if (allowed.contains(a)) {
                        return OAuth2TokenValidatorResult.success();
                    }
                }
            }
            log.warn("JWT audience mismatch tokenAud={} allowed={} traceId={}",
                    tokenAud, allowed, RequestContextHolder.currentTraceId().orElse(null));
            return OAuth2TokenValidatorResult.failure(new OAuth2Error(
                    "invalid_token",
                    "Missing required audience (tokenAud=" + tokenAud + ", allowed=" + allowed + ")",
                    null
            ));
        };
    }
}
