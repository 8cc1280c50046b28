package com.voxpop.backend.services;

import com.voxpop.backend.dto.TagDto;
import com.voxpop.backend.dto.TagRequest;
import com.voxpop.backend.enums.SystemTag;
import com.voxpop.backend.exceptions.TagDeletionBlockedException;
import com.voxpop.backend.exceptions.ValidationException;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.ContactRepository;
import com.voxpop.backend.repositories.TagRepository;
import com.voxpop.backend.services.campaign.CampaignReferenceChecker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.voxpop.backend.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TagServiceTest {

    @Mock
    private TagRepository tagRepository;

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private CampaignReferenceChecker campaignReferenceChecker;

    @InjectMocks
    private TagService tagService;

    @Test
    void testListTags_CarriesCounts() {
        // Given
        Tag saude = userTag(10L, "Saude");
        when(tagRepository.findAllByOrderByIsSystemDescNameAsc()).thenReturn(List.of(LEAD_TAG, saude));
        when(contactRepository.countLiveByTagId(1L)).thenReturn(12L);
        when(contactRepository.countLiveByTagId(10L)).thenReturn(3L);

        // When
        List<TagDto> tags = tagService.listTags(null);

        // Then
        assertEquals(2, tags.size());
        assertTrue(tags.get(0).getIsSystem());
        assertEquals(12L, tags.get(0).getContactCount());
        assertFalse(tags.get(1).getIsSystem());
        assertEquals(3L, tags.get(1).getContactCount());
    }

    @Test
    void testListTags_SystemPartition() {
        when(tagRepository.findByIsSystemOrderByNameAsc(false)).thenReturn(List.of());

        assertTrue(tagService.listTags(false).isEmpty());
        verify(tagRepository, never()).findAllByOrderByIsSystemDescNameAsc();
    }

    @Test
    void testCreateTag_GeneratesSlug() {
        // Given
        TagRequest request = TagRequest.builder().name("Saúde Pública").build();
        when(tagRepository.save(any(Tag.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        TagDto dto = tagService.createTag(request);

        // Then
        assertEquals("saude-publica", dto.getSlug());
        assertEquals("#6B7280", dto.getColor());
        assertFalse(dto.getIsSystem());
        assertTrue(dto.getIsActive());
        assertEquals(0L, dto.getContactCount());
    }

    @Test
    void testCreateTag_DuplicateNameRejected() {
        when(tagRepository.existsByNameIgnoreCase("Saude")).thenReturn(true);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> tagService.createTag(TagRequest.builder().name("Saude").build()));

        assertEquals("name", ex.getField());
    }

    @Test
    void testCreateTag_DuplicateSlugRejected() {
        when(tagRepository.existsBySlug("saude")).thenReturn(true);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> tagService.createTag(TagRequest.builder().name("Saúde").build()));

        assertEquals("slug", ex.getField());
    }

    @Test
    void testUpdateTag_SystemTagCannotBeRenamed() {
        Tag lead = systemTag(1L, SystemTag.LEAD);
        when(tagRepository.findById(1L)).thenReturn(Optional.of(lead));

        assertThrows(ValidationException.class,
                () -> tagService.updateTag(1L, TagRequest.builder().name("Prospect").build()));
        verify(tagRepository, never()).save(any());
    }

    @Test
    void testUpdateTag_SystemTagColorMayChange() {
        Tag lead = systemTag(1L, SystemTag.LEAD);
        when(tagRepository.findById(1L)).thenReturn(Optional.of(lead));
        when(tagRepository.save(lead)).thenReturn(lead);

        TagDto dto = tagService.updateTag(1L, TagRequest.builder().name("Lead").color("#000000").build());

        assertEquals("#000000", dto.getColor());
        assertEquals("lead", dto.getSlug());
    }

    @Test
    void testDeleteTag_SystemTagBlocked() {
        when(tagRepository.findById(1L)).thenReturn(Optional.of(LEAD_TAG));

        assertThrows(TagDeletionBlockedException.class, () -> tagService.deleteTag(1L));
        verify(tagRepository, never()).delete(any());
    }

    @Test
    void testDeleteTag_CampaignReferenceBlocks() {
        Tag saude = userTag(10L, "Saude");
        when(tagRepository.findById(10L)).thenReturn(Optional.of(saude));
        when(campaignReferenceChecker.isTagReferenced(10L)).thenReturn(true);

        TagDeletionBlockedException ex = assertThrows(TagDeletionBlockedException.class, () -> tagService.deleteTag(10L));

        assertEquals(10L, ex.getTagId());
        verify(contactRepository, never()).detachTagFromAllContacts(anyLong());
    }

    @Test
    void testDeleteTag_DetachesFromContacts() {
        Tag saude = userTag(10L, "Saude");
        when(tagRepository.findById(10L)).thenReturn(Optional.of(saude));
        when(campaignReferenceChecker.isTagReferenced(10L)).thenReturn(false);
        when(contactRepository.detachTagFromAllContacts(10L)).thenReturn(4);

        tagService.deleteTag(10L);

        verify(tagRepository).delete(saude);
    }

    @Test
    void testResolveUserTags() {
        // Given
        Tag saude = userTag(10L, "Saude");
        when(tagRepository.findAllById(anyIterable())).thenReturn(List.of(saude));

        // When
        Set<Tag> tags = tagService.resolveUserTags(List.of(10L), "tagIds");

        // Then
        assertThat(tags).containsExactly(saude);
    }

    @Test
    void testResolveUserTags_SystemTagRejected() {
        when(tagRepository.findAllById(anyIterable())).thenReturn(List.of(LEAD_TAG));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> tagService.resolveUserTags(List.of(1L), "auto_tag_ids"));

        assertEquals("auto_tag_ids", ex.getField());
    }

    @Test
    void testResolveUserTags_MissingOrInactiveRejected() {
        Tag inactive = userTag(11L, "Old");
        inactive.setIsActive(false);
        when(tagRepository.findAllById(anyIterable())).thenReturn(List.of(inactive));

        assertThrows(ValidationException.class, () -> tagService.resolveUserTags(List.of(11L, 12L), "tagIds"));
    }

    @Test
    void testResolveUserTags_EmptyInput() {
        assertTrue(tagService.resolveUserTags(null, "tagIds").isEmpty());
        verifyNoInteractions(tagRepository);
    }
}
