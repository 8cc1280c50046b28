package com.voxpop.backend.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxpop.backend.enums.ContactSource;
import com.voxpop.backend.enums.Gender;
import com.voxpop.backend.enums.LifecycleStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Entity
@Table(name = "contacts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "tags")
public class Contact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // Canonical form, see PhoneNormalizer. Uniqueness among live contacts is enforced by a partial index
    @Column(nullable = false, length = 20)
    private String phone;

    private String email;

    @Column(length = 14)
    private String cpf;

    private String city;

    private String neighborhood;

    @Column(length = 2)
    private String state;

    @Column(name = "zip_code", length = 10)
    private String zipCode;

    @Column(name = "electoral_zone", length = 10)
    private String electoralZone;

    @Column(name = "electoral_section", length = 10)
    private String electoralSection;

    @Column(name = "birth_date")
    private LocalDate birthDate;

    @Enumerated(EnumType.STRING)
    @Column(length = 1)
    private Gender gender;

    @Column(name = "whatsapp_opt_in", nullable = false)
    @Builder.Default
    private Boolean whatsappOptIn = false;

    @Column(name = "opt_in_date")
    private OffsetDateTime optInDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private ContactSource source = ContactSource.MANUAL;

    // Remembered while blacklisted so unblacklisting can restore it
    @Enumerated(EnumType.STRING)
    @Column(name = "status_before_blacklist", length = 12)
    private LifecycleStatus statusBeforeBlacklist;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(
            name = "contact_tags",
            joinColumns = @JoinColumn(name = "contact_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id"))
    @Builder.Default
    private Set<Tag> tags = new HashSet<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extra_data", columnDefinition = "jsonb")
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private String extraDataJson;

    @Transient
    @Builder.Default
    private Map<String, Object> extraData = new HashMap<>();

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        }
        updatedAt = OffsetDateTime.now(ZoneOffset.UTC);
        syncExtraDataToJson();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now(ZoneOffset.UTC);
        syncExtraDataToJson();
    }

    @PostLoad
    protected void onLoad() {
        syncExtraDataFromJson();
    }

    private void syncExtraDataToJson() {
        if (extraData == null || extraData.isEmpty()) {
            this.extraDataJson = null;
            return;
        }
        try {
            this.extraDataJson = new ObjectMapper().writeValueAsString(extraData);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Contact extra data is not serializable", e);
        }
    }

    private void syncExtraDataFromJson() {
        if (extraDataJson == null || extraDataJson.trim().isEmpty()) {
            this.extraData = new HashMap<>();
            return;
        }
        try {
            Map<String, Object> parsed = new ObjectMapper().readValue(extraDataJson, new TypeReference<Map<String, Object>>() {});
            this.extraData = parsed != null ? parsed : new HashMap<>();
        } catch (JsonProcessingException e) {
            this.extraData = new HashMap<>();
        }
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isOptedIn() {
        return Boolean.TRUE.equals(whatsappOptIn);
    }

    public Set<Long> getTagIds() {
        if (tags == null) {
            return new HashSet<>();
        }
        return tags.stream().map(Tag::getId).collect(Collectors.toSet());
    }

    public Set<Tag> getUserTags() {
        if (tags == null) {
            return new HashSet<>();
        }
        return tags.stream().filter(t -> !t.isSystemTag()).collect(Collectors.toSet());
    }
}
