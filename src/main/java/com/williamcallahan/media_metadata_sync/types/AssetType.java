/**
 * Asset slots maintained in the asset tree
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

public enum AssetType {
    POSTER("poster", "poster_average"),
    BACKGROUND("background", "bg_average"),
    SEASON_POSTER("season poster", "poster_average");

    private final String label;
    private final String qualityMetric;

    AssetType(String label, String qualityMetric) {
        this.label = label;
        this.qualityMetric = qualityMetric;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Name of the quality metric recorded in the owning cache entry
     */
    public String getQualityMetric() {
        return qualityMetric;
    }
}
