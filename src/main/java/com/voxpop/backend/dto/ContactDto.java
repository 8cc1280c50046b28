package com.voxpop.backend.dto;

import com.voxpop.backend.enums.ContactSource;
import com.voxpop.backend.enums.Gender;
import com.voxpop.backend.enums.LifecycleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactDto {
    private Long id;
    private String name;
    private String phone;
    private String email;
    private String cpf;
    private String city;
    private String neighborhood;
    private String state;
    private String zipCode;
    private String electoralZone;
    private String electoralSection;
    private LocalDate birthDate;
    private Integer age;
    private Gender gender;
    private Boolean whatsappOptIn;
    private OffsetDateTime optInDate;
    private ContactSource source;
    private LifecycleStatus contactStatus;
    private List<TagSummary> tags;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TagSummary {
        private Long id;
        private String name;
        private String slug;
        private String color;
        private Boolean isSystem;
    }
}
