package com.voxpop.backend.services.imports;

import com.voxpop.backend.enums.ContactSource;
import com.voxpop.backend.enums.DuplicateMode;
import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.ContactRepository;
import com.voxpop.backend.services.lifecycle.ContactTransitionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.voxpop.backend.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContactImportWriterTest {

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private ContactTransitionService contactTransitionService;

    @InjectMocks
    private ContactImportWriter writer;

    private static ImportRow row(String name, String city) {
        return new ImportRow(2, name, "5511987654321", null, null, city, null, null, null, null, null,
                LocalDate.of(1990, 1, 1), null);
    }

    @Test
    void testWrite_NewContactIsImportedLead() {
        // Given
        Tag campanha = userTag(20L, "Campanha 2026");
        when(contactRepository.findByPhoneForUpdate("5511987654321")).thenReturn(Optional.empty());

        // When
        ContactImportWriter.Outcome outcome = writer.write(row("Maria", "Campinas"), List.of(campanha), DuplicateMode.UPDATE);

        // Then
        assertEquals(ContactImportWriter.Outcome.CREATED, outcome);
        ArgumentCaptor<Contact> captor = ArgumentCaptor.forClass(Contact.class);
        verify(contactRepository).saveAndFlush(captor.capture());
        Contact saved = captor.getValue();
        assertEquals(ContactSource.IMPORT, saved.getSource());
        assertEquals("Campinas", saved.getCity());
        assertThat(saved.getTags()).contains(campanha);
        verify(contactTransitionService).assignInitialStatus(saved, LifecycleStatus.LEAD);
    }

    @Test
    void testWrite_ExistingContactMerged() {
        // Given
        Contact existing = contact(7L, APOIADOR_TAG, userTag(10L, "Saude"));
        existing.setCity("Santos");
        existing.setEmail("old@example.com");
        when(contactRepository.findByPhoneForUpdate("5511987654321")).thenReturn(Optional.of(existing));
        Tag campanha = userTag(20L, "Campanha 2026");

        // When
        ContactImportWriter.Outcome outcome = writer.write(row("Maria Souza", "Campinas"), List.of(campanha), DuplicateMode.UPDATE);

        // Then
        assertEquals(ContactImportWriter.Outcome.UPDATED, outcome);
        assertEquals("Maria Souza", existing.getName());
        assertEquals("Campinas", existing.getCity());
        assertEquals("old@example.com", existing.getEmail());
        assertEquals(3, existing.getTags().size());
        assertTrue(existing.getTags().contains(APOIADOR_TAG));
        verify(contactRepository).saveAndFlush(existing);
        verifyNoInteractions(contactTransitionService);
    }

    @Test
    void testWrite_SkipModeLeavesExistingUntouched() {
        Contact existing = contact(7L, LEAD_TAG);
        existing.setCity("Santos");
        when(contactRepository.findByPhoneForUpdate("5511987654321")).thenReturn(Optional.of(existing));

        ContactImportWriter.Outcome outcome = writer.write(row("Maria", "Campinas"), List.of(), DuplicateMode.SKIP);

        assertEquals(ContactImportWriter.Outcome.SKIPPED, outcome);
        assertEquals("Santos", existing.getCity());
        verify(contactRepository, never()).saveAndFlush(any());
    }
}
