package com.voxpop.backend.services.lifecycle;

import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.models.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.voxpop.backend.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LifecycleStatusDeriverTest {

    @Test
    void testDerive_NoTags() {
        assertEquals(LifecycleStatus.NONE, LifecycleStatusDeriver.derive(Set.of()));
        assertEquals(LifecycleStatus.NONE, LifecycleStatusDeriver.derive((List<Tag>) null));
    }

    @Test
    void testDerive_SingleStatusTag() {
        assertEquals(LifecycleStatus.LEAD, LifecycleStatusDeriver.derive(List.of(LEAD_TAG)));
        assertEquals(LifecycleStatus.APOIADOR, LifecycleStatusDeriver.derive(List.of(APOIADOR_TAG)));
        assertEquals(LifecycleStatus.BLACKLIST, LifecycleStatusDeriver.derive(List.of(BLACKLIST_TAG)));
    }

    @Test
    void testDerive_UserTagsDoNotCount() {
        assertEquals(LifecycleStatus.NONE,
                LifecycleStatusDeriver.derive(List.of(userTag(10L, "Saude"), userTag(11L, "Zona Norte"))));
    }

    @Test
    void testDerive_UserTagWithSystemSlugIsIgnored() {
        // Given a non-system tag that happens to be slugged "lead"
        Tag impostor = userTag(12L, "Lead");

        // Then
        assertEquals(LifecycleStatus.NONE, LifecycleStatusDeriver.derive(List.of(impostor)));
    }

    @Test
    void testDerive_MostRestrictiveWins() {
        assertEquals(LifecycleStatus.BLACKLIST,
                LifecycleStatusDeriver.derive(List.of(LEAD_TAG, APOIADOR_TAG, BLACKLIST_TAG)));
        assertEquals(LifecycleStatus.APOIADOR,
                LifecycleStatusDeriver.derive(List.of(LEAD_TAG, APOIADOR_TAG)));
        assertEquals(LifecycleStatus.BLACKLIST,
                LifecycleStatusDeriver.derive(List.of(BLACKLIST_TAG, LEAD_TAG)));
    }

    @Test
    void testDerive_FromContact() {
        assertEquals(LifecycleStatus.APOIADOR,
                LifecycleStatusDeriver.derive(contact(1L, APOIADOR_TAG, userTag(10L, "Saude"))));
    }

    @Test
    void testIsLifecycleTag() {
        assertTrue(LifecycleStatusDeriver.isLifecycleTag(LEAD_TAG));
        assertFalse(LifecycleStatusDeriver.isLifecycleTag(userTag(10L, "Saude")));
        assertFalse(LifecycleStatusDeriver.isLifecycleTag(null));
    }
}
