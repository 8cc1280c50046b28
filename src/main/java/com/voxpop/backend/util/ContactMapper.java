package com.voxpop.backend.util;

import com.voxpop.backend.dto.ContactDto;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.services.lifecycle.LifecycleStatusDeriver;

import java.time.LocalDate;
import java.time.Period;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class ContactMapper {

    /**
     * @param today reference date for the computed age
     */
    public static ContactDto toDto(Contact contact, LocalDate today) {
        if (contact == null) {
            return null;
        }

        return ContactDto.builder()
                .id(contact.getId())
                .name(contact.getName())
                .phone(contact.getPhone())
                .email(contact.getEmail())
                .cpf(contact.getCpf())
                .city(contact.getCity())
                .neighborhood(contact.getNeighborhood())
                .state(contact.getState())
                .zipCode(contact.getZipCode())
                .electoralZone(contact.getElectoralZone())
                .electoralSection(contact.getElectoralSection())
                .birthDate(contact.getBirthDate())
                .age(contact.getBirthDate() != null ? Period.between(contact.getBirthDate(), today).getYears() : null)
                .gender(contact.getGender())
                .whatsappOptIn(contact.getWhatsappOptIn())
                .optInDate(contact.getOptInDate())
                .source(contact.getSource())
                // Derived on read, never stored
                .contactStatus(LifecycleStatusDeriver.derive(contact))
                .tags(toTagSummaries(contact))
                .createdAt(contact.getCreatedAt())
                .updatedAt(contact.getUpdatedAt())
                .build();
    }

    public static List<ContactDto> toDtos(List<Contact> contacts, LocalDate today) {
        return contacts.stream().map(c -> toDto(c, today)).collect(Collectors.toList());
    }

    private static List<ContactDto.TagSummary> toTagSummaries(Contact contact) {
        if (contact.getTags() == null) {
            return List.of();
        }
        return contact.getTags().stream()
                .sorted(Comparator.comparing(Tag::isSystemTag).reversed().thenComparing(Tag::getName))
                .map(tag -> ContactDto.TagSummary.builder()
                        .id(tag.getId())
                        .name(tag.getName())
                        .slug(tag.getSlug())
                        .color(tag.getColor())
                        .isSystem(tag.isSystemTag())
                        .build())
                .collect(Collectors.toList());
    }
}
