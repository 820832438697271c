/**
 * Test class for MetadataSyncScheduler
 *
 * @author William Callahan
 *
 * Verifies the enable flag gates scheduled runs
 */

package com.williamcallahan.media_metadata_sync.scheduler;

import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetadataSyncSchedulerTest {

    @Mock
    private MetadataSyncRunner runner;

    private MetadataSyncProperties properties;
    private MetadataSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new MetadataSyncProperties();
        scheduler = new MetadataSyncScheduler(runner, properties);
    }

    @Test
    void scheduledSync_shouldTriggerRunWhenEnabled() {
        when(runner.runOnce("schedule")).thenReturn(Optional.empty());

        scheduler.scheduledSync();

        verify(runner, times(1)).runOnce("schedule");
    }

    @Test
    void scheduledSync_shouldReturnImmediatelyWhenDisabled() {
        properties.getSettings().setScheduleEnabled(false);

        assertDoesNotThrow(() -> scheduler.scheduledSync(), "Disabled scheduler should complete without exception");

        verify(runner, never()).runOnce(anyString());
    }
}
