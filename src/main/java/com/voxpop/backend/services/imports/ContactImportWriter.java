package com.voxpop.backend.services.imports;

import com.voxpop.backend.enums.ContactSource;
import com.voxpop.backend.enums.DuplicateMode;
import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.ContactRepository;
import com.voxpop.backend.services.lifecycle.ContactTransitionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Optional;

/**
 * Writes one import row, deduplicating on canonical phone. Each call is its own transaction so a
 * failing row never undoes the rows before it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContactImportWriter {

    public enum Outcome {
        CREATED, UPDATED, SKIPPED
    }

    private final ContactRepository contactRepository;
    private final ContactTransitionService contactTransitionService;

    @Transactional
    public Outcome write(ImportRow row, Collection<Tag> autoTags, DuplicateMode duplicateMode) {
        Optional<Contact> existing = contactRepository.findByPhoneForUpdate(row.phone());

        if (existing.isPresent()) {
            if (duplicateMode == DuplicateMode.SKIP) {
                log.debug("Row {}: phone already belongs to contact {}, skipped", row.rowNumber(), existing.get().getId());
                return Outcome.SKIPPED;
            }
            Contact merged = mergeInto(existing.get(), row, autoTags);
            contactRepository.saveAndFlush(merged);
            return Outcome.UPDATED;
        }

        Contact contact = Contact.builder()
                .name(row.name())
                .phone(row.phone())
                .source(ContactSource.IMPORT)
                .build();
        mergeInto(contact, row, autoTags);
        contactTransitionService.assignInitialStatus(contact, LifecycleStatus.LEAD);
        contactRepository.saveAndFlush(contact);
        return Outcome.CREATED;
    }

    /**
     * Non-empty incoming values win, empty cells keep what is stored, tags are unioned. The lifecycle
     * status of an existing contact is never touched here.
     */
    Contact mergeInto(Contact target, ImportRow row, Collection<Tag> autoTags) {
        target.setName(prefer(row.name(), target.getName()));
        target.setEmail(prefer(row.email(), target.getEmail()));
        target.setCpf(prefer(row.cpf(), target.getCpf()));
        target.setCity(prefer(row.city(), target.getCity()));
        target.setState(prefer(row.state(), target.getState()));
        target.setNeighborhood(prefer(row.neighborhood(), target.getNeighborhood()));
        target.setZipCode(prefer(row.zipCode(), target.getZipCode()));
        target.setElectoralZone(prefer(row.electoralZone(), target.getElectoralZone()));
        target.setElectoralSection(prefer(row.electoralSection(), target.getElectoralSection()));

        if (row.birthDate() != null) {
            target.setBirthDate(row.birthDate());
        }
        if (row.gender() != null) {
            target.setGender(row.gender());
        }
        if (autoTags != null) {
            target.getTags().addAll(autoTags);
        }
        return target;
    }

    private static String prefer(String incoming, String current) {
        return incoming != null && !incoming.isBlank() ? incoming : current;
    }
}
