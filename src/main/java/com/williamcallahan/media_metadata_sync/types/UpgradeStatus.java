/**
 * Outcome codes produced by the asset upgrade decision
 *
 * @author William Callahan
 *
 * Features:
 * - One code per decision rule, first matching rule wins
 * - Distinguishes "cannot compare" outcomes from a plain no-op
 * - Used for logging, metrics and per-library summaries
 */
package com.williamcallahan.media_metadata_sync.types;

public enum UpgradeStatus {
    /**
     * Candidate vote average beats the cached quality score
     */
    UPGRADE_VOTES(true),

    /**
     * Nothing cached yet and the candidate clears the configured vote threshold
     */
    UPGRADE_THRESHOLD(true),

    /**
     * No asset exists at the deterministic path
     */
    NO_EXISTING_ASSET(true),

    /**
     * Candidate is strictly wider or taller than the existing file
     */
    UPGRADE_DIMENSIONS(true),

    /**
     * Local copy of the candidate is missing, dimensions cannot be compared
     */
    NO_IMAGE_FOR_COMPARE(false),

    /**
     * Local copy or existing file could not be decoded
     */
    ERROR_IMAGE_COMPARE(false),

    NO_UPGRADE_NEEDED(false);

    private final boolean upgrade;

    UpgradeStatus(boolean upgrade) {
        this.upgrade = upgrade;
    }

    public boolean isUpgrade() {
        return upgrade;
    }
}
