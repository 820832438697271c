/**
 * What happened to one item's metadata record during a run
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

public enum MetadataAction {
    CREATED,
    UPDATED,
    UNCHANGED,
    SKIPPED,
    FAILED
}
