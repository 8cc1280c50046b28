package com.voxpop.backend.services.lifecycle;

import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.enums.Transition;
import com.voxpop.backend.exceptions.InvalidTransitionException;
import com.voxpop.backend.exceptions.ResourceNotFoundException;
import com.voxpop.backend.exceptions.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BulkTransitionServiceTest {

    @Mock
    private ContactTransitionService contactTransitionService;

    @InjectMocks
    private BulkTransitionService bulkTransitionService;

    private TransitionResult changed(Long id) {
        return new TransitionResult(id, Transition.PROMOTE, LifecycleStatus.LEAD, LifecycleStatus.APOIADOR, true);
    }

    private TransitionResult unchanged(Long id) {
        return new TransitionResult(id, Transition.PROMOTE, LifecycleStatus.APOIADOR, LifecycleStatus.APOIADOR, false);
    }

    @Test
    void testApply_AllSucceed() {
        // Given
        when(contactTransitionService.apply(1L, Transition.PROMOTE)).thenReturn(changed(1L));
        when(contactTransitionService.apply(2L, Transition.PROMOTE)).thenReturn(changed(2L));
        when(contactTransitionService.apply(3L, Transition.PROMOTE)).thenReturn(unchanged(3L));

        // When
        BulkTransitionResult result = bulkTransitionService.apply(List.of(1L, 2L, 3L), Transition.PROMOTE);

        // Then
        assertTrue(result.success());
        assertEquals(2, result.updatedCount());
        assertEquals(1, result.unchangedCount());
        assertEquals(0, result.failedCount());
        assertEquals("2 contacts promoted, 1 already up to date", result.message());
    }

    @Test
    void testApply_FailuresDoNotStopTheBatch() {
        // Given
        when(contactTransitionService.apply(1L, Transition.PROMOTE)).thenReturn(changed(1L));
        when(contactTransitionService.apply(2L, Transition.PROMOTE))
                .thenThrow(new InvalidTransitionException(2L, LifecycleStatus.BLACKLIST, Transition.PROMOTE));
        when(contactTransitionService.apply(3L, Transition.PROMOTE))
                .thenThrow(new ResourceNotFoundException("Contact", 3L));
        when(contactTransitionService.apply(4L, Transition.PROMOTE)).thenReturn(changed(4L));

        // When
        BulkTransitionResult result = bulkTransitionService.apply(List.of(1L, 2L, 3L, 4L), Transition.PROMOTE);

        // Then
        assertFalse(result.success());
        assertEquals(2, result.updatedCount());
        assertEquals(2, result.failedCount());
        assertEquals("2 contacts promoted, 2 could not be changed", result.message());
        verify(contactTransitionService).apply(4L, Transition.PROMOTE);
    }

    @Test
    void testApply_DuplicateIdsProcessedOnce() {
        when(contactTransitionService.apply(7L, Transition.PROMOTE)).thenReturn(changed(7L));

        BulkTransitionResult result = bulkTransitionService.apply(Arrays.asList(7L, 7L, null, 7L), Transition.PROMOTE);

        assertEquals(1, result.updatedCount());
        assertEquals("1 contact promoted", result.message());
        verify(contactTransitionService, times(1)).apply(7L, Transition.PROMOTE);
    }

    @Test
    void testApply_EmptyListRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> bulkTransitionService.apply(List.of(), Transition.BLACKLIST));

        assertEquals("supporterIds", ex.getField());
        verifyNoInteractions(contactTransitionService);
    }
}
