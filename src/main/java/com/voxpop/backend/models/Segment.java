package com.voxpop.backend.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named filter specification plus the audience snapshot taken the last time it was resolved.
 * The cached numbers are not kept live against contact changes.
 */
@Entity
@Table(name = "segments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "filtersJson")
public class Segment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    // Stored as-is, unknown keys included
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "filters", columnDefinition = "jsonb")
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private String filtersJson;

    @Transient
    @Builder.Default
    private Map<String, Object> filters = new LinkedHashMap<>();

    @Column(name = "cached_count", nullable = false)
    @Builder.Default
    private Long cachedCount = 0L;

    @Column(name = "leads_count", nullable = false)
    @Builder.Default
    private Long leadsCount = 0L;

    @Column(name = "supporters_count", nullable = false)
    @Builder.Default
    private Long supportersCount = 0L;

    @Column(name = "blacklist_count", nullable = false)
    @Builder.Default
    private Long blacklistCount = 0L;

    @Column(name = "cached_at")
    private OffsetDateTime cachedAt;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        }
        updatedAt = OffsetDateTime.now(ZoneOffset.UTC);
        syncFiltersToJson();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now(ZoneOffset.UTC);
        syncFiltersToJson();
    }

    @PostLoad
    protected void onLoad() {
        syncFiltersFromJson();
    }

    private void syncFiltersToJson() {
        try {
            this.filtersJson = new ObjectMapper().writeValueAsString(filters != null ? filters : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Segment filters are not serializable", e);
        }
    }

    private void syncFiltersFromJson() {
        if (filtersJson == null || filtersJson.trim().isEmpty()) {
            this.filters = new LinkedHashMap<>();
            return;
        }
        try {
            Map<String, Object> parsed = new ObjectMapper().readValue(filtersJson,
                    new TypeReference<LinkedHashMap<String, Object>>() {});
            this.filters = parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored filters of segment " + id + " are not valid JSON", e);
        }
    }
}
