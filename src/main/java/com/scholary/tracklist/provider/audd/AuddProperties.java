package com.scholary.tracklist.provider.audd;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the AudD recognition API.
 *
 * <p>AudD does not score its matches, so every match is reported with {@code matchConfidence}.
 */
@ConfigurationProperties(prefix = "providers.audd")
@Validated
public record AuddProperties(
    boolean enabled,
    @NotBlank String baseUrl,
    String apiToken,
    @DecimalMin("0.0") @DecimalMax("1.0") double matchConfidence,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
