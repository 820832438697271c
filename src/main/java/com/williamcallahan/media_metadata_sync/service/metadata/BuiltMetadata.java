/**
 * A freshly built record with its completeness score
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_metadata_sync.model.MetadataRecord;

/**
 * @param record              record ready for diffing
 * @param completenessPercent share of expected, non-ignored fields that carry a value (0-100)
 * @param details             catalog details payload the record was built from
 */
public record BuiltMetadata(MetadataRecord record, int completenessPercent, JsonNode details) {
}
