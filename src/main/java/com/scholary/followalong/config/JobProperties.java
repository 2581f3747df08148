package com.scholary.followalong.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the job worker. */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record JobProperties(boolean resumeOnStartup, @NotBlank String threadNamePrefix) {}
