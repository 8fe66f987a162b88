package com.scholary.tracklist.provider.acrcloud;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ACRCloud identification API.
 *
 * <p>{@code baseUrl} is the regional identify host, e.g. {@code
 * https://identify-eu-west-1.acrcloud.com}.
 */
@ConfigurationProperties(prefix = "providers.acrcloud")
@Validated
public record AcrCloudProperties(
    boolean enabled,
    @NotBlank String baseUrl,
    String accessKey,
    String accessSecret,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
