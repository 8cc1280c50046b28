package com.voxpop.backend.controllers;

import com.voxpop.backend.dto.TransitionResponse;
import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.enums.Transition;
import com.voxpop.backend.services.lifecycle.TransitionResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContactControllerTest {

    @Test
    void testToResponse_Changed() {
        TransitionResponse response = ContactController.toResponse(
                new TransitionResult(3L, Transition.PROMOTE, LifecycleStatus.LEAD, LifecycleStatus.APOIADOR, true));

        assertEquals(3L, response.getContactId());
        assertEquals(LifecycleStatus.LEAD, response.getPreviousStatus());
        assertEquals(LifecycleStatus.APOIADOR, response.getContactStatus());
        assertTrue(response.isChanged());
        assertEquals("Contact 3 moved from lead to apoiador", response.getMessage());
    }

    @Test
    void testToResponse_NoOp() {
        TransitionResponse response = ContactController.toResponse(
                new TransitionResult(3L, Transition.BLACKLIST, LifecycleStatus.BLACKLIST, LifecycleStatus.BLACKLIST, false));

        assertFalse(response.isChanged());
        assertEquals("Contact 3 is already blacklist", response.getMessage());
    }
}
