package com.starwatch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.worker.sync")
public record SyncProperties(
    @NotNull Boolean enabled,
    @NotNull @Min(1000) Long intervalMs,
    @NotNull @Min(1) Integer fullRefreshEvery
) {}
