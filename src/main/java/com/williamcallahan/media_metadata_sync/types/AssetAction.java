/**
 * Outcome of processing one asset slot for one item
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

import java.nio.file.Path;

/**
 * @param type     asset slot
 * @param target   deterministic path of the asset
 * @param status   upgrade decision status, null when no candidate was available
 * @param written  whether a file was written in this run
 * @param bytes    size of the written file, 0 when nothing was written
 * @param detail   short reason for skips and failures
 */
public record AssetAction(AssetType type, Path target, UpgradeStatus status, boolean written, long bytes, String detail) {

    public static AssetAction skipped(AssetType type, Path target, String detail) {
        return new AssetAction(type, target, null, false, 0L, detail);
    }
}
