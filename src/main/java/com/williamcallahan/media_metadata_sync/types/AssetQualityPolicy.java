/**
 * Vote and dimension thresholds used to pick and replace one kind of asset
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

public record AssetQualityPolicy(
    double preferredVote,
    double relaxedVote,
    double voteThreshold,
    int preferredWidth,
    int preferredHeight,
    int minWidth,
    int minHeight
) {
}
