package com.qrwallet.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.response.ErrorResponse;
import com.qrwallet.security.CallerAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.preauth.AbstractPreAuthenticatedProcessingFilter;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final Environment environment;
    private final ObjectMapper objectMapper;

    public SecurityConfig(Environment environment, ObjectMapper objectMapper) {
        this.environment = environment;
        this.objectMapper = objectMapper;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .authorizeHttpRequests(auth -> {
                    List<String> profiles = Arrays.asList(environment.getActiveProfiles());
                    if (!profiles.contains("dev")) {
                        auth.requestMatchers("/v3/api-docs/**").denyAll();
                        auth.requestMatchers("/swagger-ui/**").denyAll();
                    }
                    // Gateway callbacks authenticate by signature or token inside the handler
                    auth.requestMatchers("/gatewayWebhook", "/momoWebhook").permitAll();
                    auth.requestMatchers("/api/v1/**").authenticated();
                    auth.anyRequest().permitAll();
                })
                .addFilterBefore(new CallerAuthenticationFilter(), AbstractPreAuthenticatedProcessingFilter.class)
                .exceptionHandling(handling -> handling.authenticationEntryPoint(unauthenticatedEntryPoint()))
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .build();
    }

    private AuthenticationEntryPoint unauthenticatedEntryPoint() {
        return (request, response, authException) -> {
            ErrorCode code = ErrorCode.AUTH_UNAUTHENTICATED;
            ErrorResponse body = ErrorResponse.of(code.name(), code.transportStatus().wireName(),
                    code.defaultMessage(), Map.of(), request.getRequestURI());
            response.setStatus(code.transportStatus().httpStatus());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), body);
        };
    }
}
