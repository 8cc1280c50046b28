package com.voxpop.backend.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxpop.backend.enums.DuplicateMode;
import com.voxpop.backend.enums.ImportStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracked run of one spreadsheet upload. Status moves pending -> processing -> completed|failed and
 * never leaves a terminal state; the row counters only grow.
 */
@Entity
@Table(name = "import_jobs")
@Getter
@Setter
@NoArgsConstructor
public class ImportJob {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    // Path of the stored upload, internal to the worker
    @Column(name = "stored_path", length = 500)
    private String storedPath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12)
    @Setter(AccessLevel.NONE)
    private ImportStatus status = ImportStatus.PENDING;

    @Column(name = "total_rows", nullable = false)
    @Setter(AccessLevel.NONE)
    private Integer totalRows = 0;

    @Column(name = "processed_rows", nullable = false)
    @Setter(AccessLevel.NONE)
    private Integer processedRows = 0;

    @Column(name = "success_count", nullable = false)
    @Setter(AccessLevel.NONE)
    private Integer successCount = 0;

    @Column(name = "created_count", nullable = false)
    @Setter(AccessLevel.NONE)
    private Integer createdCount = 0;

    @Column(name = "updated_count", nullable = false)
    @Setter(AccessLevel.NONE)
    private Integer updatedCount = 0;

    @Column(name = "skipped_count", nullable = false)
    @Setter(AccessLevel.NONE)
    private Integer skippedCount = 0;

    @Column(name = "error_count", nullable = false)
    @Setter(AccessLevel.NONE)
    private Integer errorCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "duplicate_mode", nullable = false, length = 10)
    private DuplicateMode duplicateMode = DuplicateMode.UPDATE;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "column_mapping", columnDefinition = "jsonb")
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private String columnMappingJson;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "auto_tag_ids", columnDefinition = "jsonb")
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private String autoTagIdsJson;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "errors_log", columnDefinition = "jsonb")
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private String errorsLogJson;

    @Transient
    @Setter(AccessLevel.NONE)
    private Map<String, Object> columnMapping = new LinkedHashMap<>();

    @Transient
    @Setter(AccessLevel.NONE)
    private List<Long> autoTagIds = new ArrayList<>();

    @Transient
    @Setter(AccessLevel.NONE)
    private List<Map<String, Object>> errorsLog = new ArrayList<>();

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private int maxLoggedErrors = Integer.MAX_VALUE;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "started_at")
    @Setter(AccessLevel.NONE)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    @Setter(AccessLevel.NONE)
    private OffsetDateTime completedAt;

    public ImportJob(String fileName, Map<String, Object> columnMapping, List<Long> autoTagIds,
                     DuplicateMode duplicateMode, Long createdBy) {
        this.fileName = fileName;
        this.duplicateMode = duplicateMode != null ? duplicateMode : DuplicateMode.UPDATE;
        this.createdBy = createdBy;
        setColumnMapping(columnMapping);
        setAutoTagIds(autoTagIds);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        }
    }

    @PostLoad
    protected void onLoad() {
        try {
            if (columnMappingJson != null && !columnMappingJson.isBlank()) {
                this.columnMapping = MAPPER.readValue(columnMappingJson, new TypeReference<LinkedHashMap<String, Object>>() {});
            }
            if (autoTagIdsJson != null && !autoTagIdsJson.isBlank()) {
                this.autoTagIds = MAPPER.readValue(autoTagIdsJson, new TypeReference<List<Long>>() {});
            }
            if (errorsLogJson != null && !errorsLogJson.isBlank()) {
                this.errorsLog = MAPPER.readValue(errorsLogJson, new TypeReference<List<Map<String, Object>>>() {});
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored state of import job " + id + " is not valid JSON", e);
        }
    }

    // JSON columns are written through on every change. The worker saves a detached instance after
    // each row, and merge only copies persistent columns.

    public void setColumnMapping(Map<String, Object> columnMapping) {
        this.columnMapping = columnMapping != null ? new LinkedHashMap<>(columnMapping) : new LinkedHashMap<>();
        this.columnMappingJson = toJson(this.columnMapping);
    }

    public void setAutoTagIds(List<Long> autoTagIds) {
        this.autoTagIds = autoTagIds != null ? new ArrayList<>(autoTagIds) : new ArrayList<>();
        this.autoTagIdsJson = toJson(this.autoTagIds);
    }

    private void appendLogEntry(Map<String, Object> entry) {
        errorsLog.add(entry);
        this.errorsLogJson = toJson(errorsLog);
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Import job state is not serializable", e);
        }
    }

    // ===== State machine =====

    public void markProcessing(int totalRows, OffsetDateTime now) {
        if (status != ImportStatus.PENDING) {
            throw new IllegalStateException("Import job " + id + " cannot start from " + status.getValue());
        }
        this.status = ImportStatus.PROCESSING;
        this.totalRows = totalRows;
        this.startedAt = now;
    }

    public void markCompleted(OffsetDateTime now) {
        requireProcessing("complete");
        this.status = ImportStatus.COMPLETED;
        this.completedAt = now;
    }

    /**
     * Fails the job from pending or processing, recording the fault as a non-row log entry.
     */
    public void markFailed(String reason, OffsetDateTime now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Import job " + id + " is already " + status.getValue());
        }
        this.status = ImportStatus.FAILED;
        this.completedAt = now;
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", "fatal");
        entry.put("message", reason);
        appendLogEntry(entry);
    }

    public void recordCreated() {
        requireProcessing("record a row");
        successCount++;
        createdCount++;
        processedRows++;
    }

    public void recordUpdated() {
        requireProcessing("record a row");
        successCount++;
        updatedCount++;
        processedRows++;
    }

    public void recordSkipped() {
        requireProcessing("record a row");
        skippedCount++;
        processedRows++;
    }

    public void recordError(int row, String field, String message) {
        requireProcessing("record a row");
        errorCount++;
        processedRows++;
        if (errorsLog.size() < maxLoggedErrors) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("row", row);
            entry.put("field", field);
            entry.put("message", message);
            appendLogEntry(entry);
        }
    }

    public void limitLoggedErrors(int maxLoggedErrors) {
        this.maxLoggedErrors = maxLoggedErrors;
    }

    private void requireProcessing(String action) {
        if (status != ImportStatus.PROCESSING) {
            throw new IllegalStateException("Cannot " + action + " on import job " + id + " in state " + status.getValue());
        }
    }

    // ===== Derived progress =====

    public boolean isCompleted() {
        return status.isTerminal();
    }

    public int getProgressPercentage() {
        if (totalRows == null || totalRows == 0) {
            return status.isTerminal() ? 100 : 0;
        }
        return (int) Math.min(100, (processedRows * 100L) / totalRows);
    }

    public Long getDurationSeconds() {
        if (startedAt == null) {
            return null;
        }
        OffsetDateTime end = completedAt != null ? completedAt : OffsetDateTime.now(ZoneOffset.UTC);
        return Duration.between(startedAt, end).getSeconds();
    }
}
