package com.voxpop.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "voxpop.imports")
public record ImportProperties(
        @DefaultValue("uploads/imports") String uploadDir,
        @DefaultValue("10485760") long maxFileSizeBytes,
        @DefaultValue({"csv", "xlsx", "xls"}) List<String> allowedExtensions,
        @DefaultValue("50000") int maxRows,
        @DefaultValue("2") int workerThreads,
        @DefaultValue("1000") int maxLoggedErrors
) {
    public boolean isAllowedExtension(String extension) {
        return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }
}
