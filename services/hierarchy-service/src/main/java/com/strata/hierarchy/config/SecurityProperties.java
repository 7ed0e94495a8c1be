package com.strata.hierarchy.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token verification settings, bound from {@code strata.security.*}.
 *
 * @param jwtSecret HMAC secret shared with the identity provider; at least 32 bytes for HS256
 * @param issuer expected {@code iss} claim; not checked when blank
 */
@ConfigurationProperties(prefix = "strata.security")
@Validated
public record SecurityProperties(@NotBlank @Size(min = 32) String jwtSecret, String issuer) {}
