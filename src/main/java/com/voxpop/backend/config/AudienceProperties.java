package com.voxpop.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "voxpop.audience")
public record AudienceProperties(
        @DefaultValue("10") int sampleSize
) {
}
