/**
 * Basic application context load test for Media Metadata Sync
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies that the Spring application context loads with the "test" profile
 * - Media server client is mocked so no Plex connection is attempted
 * - Checks that test configuration reaches the bound properties
 */

package com.williamcallahan.media_metadata_sync;

import com.williamcallahan.media_metadata_sync.client.MediaServerClient;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.scheduler.MetadataSyncRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class MediaMetadataSyncApplicationTests {

    @MockBean
    private MediaServerClient mediaServerClient;

    @Autowired
    private MetadataSyncRunner metadataSyncRunner;

    @Autowired
    private MetadataSyncProperties properties;

    @Test
    void contextLoads() {
        assertNotNull(metadataSyncRunner);
        assertFalse(metadataSyncRunner.isRunning());
        assertTrue(properties.getSettings().isDryRun());
        assertFalse(properties.getSettings().isScheduleEnabled());
    }
}
