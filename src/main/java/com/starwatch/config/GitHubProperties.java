package com.starwatch.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.github")
public record GitHubProperties(
	@NotBlank @DefaultValue("https://api.github.com/graphql") String endpoint,
	@NotBlank String token,
	@NotBlank String listId,
	@Min(1) @Max(100) @DefaultValue("100") int pageSize,
	@Min(0) @DefaultValue("3000") int readmeMaxChars
) {}
