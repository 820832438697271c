/**
 * Decides whether a downloaded candidate replaces the persisted asset
 *
 * @author William Callahan
 *
 * Features:
 * - Vote improvement over the cached quality wins first
 * - With nothing cached, a candidate clearing the vote threshold wins
 * - A missing asset is always filled
 * - Otherwise pixel dimensions of the local copy and the existing file decide
 * - Dry-run reports the same decision and marks it as not to be written
 */
package com.williamcallahan.media_metadata_sync.service.image;

import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.types.AssetCandidate;
import com.williamcallahan.media_metadata_sync.types.UpgradeDecision;
import com.williamcallahan.media_metadata_sync.types.UpgradeStatus;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
public class AssetUpgradeDecider {

    private final ImageDimensionReader dimensionReader;
    private final boolean dryRun;

    @Autowired
    public AssetUpgradeDecider(ImageDimensionReader dimensionReader, MetadataSyncProperties properties) {
        this(dimensionReader, properties.getSettings().isDryRun());
    }

    public AssetUpgradeDecider(ImageDimensionReader dimensionReader, boolean dryRun) {
        this.dimensionReader = dimensionReader;
        this.dryRun = dryRun;
    }

    /**
     * @param existingAssetPath  deterministic path of the persisted asset
     * @param candidate          selected catalog image
     * @param candidateLocalCopy downloaded copy of the candidate, may be null
     * @param cachedQuality      vote average recorded for the persisted asset, 0 when unknown
     * @param voteThreshold      vote needed to upgrade when nothing is cached
     * @return decision with the rule that produced it
     */
    public UpgradeDecision shouldUpgrade(Path existingAssetPath, AssetCandidate candidate, Path candidateLocalCopy,
                                         double cachedQuality, double voteThreshold) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("candidateVote", candidate.voteAverage());
        context.put("cachedVote", cachedQuality);
        context.put("voteThreshold", voteThreshold);

        if (candidate.voteAverage() > cachedQuality) {
            return decided(UpgradeStatus.UPGRADE_VOTES, context, existingAssetPath);
        }
        if (cachedQuality == 0.0 && candidate.voteAverage() >= voteThreshold) {
            return decided(UpgradeStatus.UPGRADE_THRESHOLD, context, existingAssetPath);
        }
        if (existingAssetPath == null || !Files.exists(existingAssetPath)) {
            return decided(UpgradeStatus.NO_EXISTING_ASSET, context, existingAssetPath);
        }
        if (candidateLocalCopy == null || !Files.exists(candidateLocalCopy)) {
            return decided(UpgradeStatus.NO_IMAGE_FOR_COMPARE, context, existingAssetPath);
        }

        ImageDimensionReader.Dimensions candidateSize;
        ImageDimensionReader.Dimensions existingSize;
        try {
            candidateSize = dimensionReader.read(candidateLocalCopy);
            existingSize = dimensionReader.read(existingAssetPath);
        } catch (IOException | RuntimeException e) {
            LoggingUtils.warn(log, e, "Unable to compare image dimensions for {}", existingAssetPath);
            context.put("error", e.getMessage());
            return decided(UpgradeStatus.ERROR_IMAGE_COMPARE, context, existingAssetPath);
        }
        context.put("candidateSize", candidateSize.width() + "x" + candidateSize.height());
        context.put("existingSize", existingSize.width() + "x" + existingSize.height());

        if (candidateSize.exceedsEither(existingSize)) {
            return decided(UpgradeStatus.UPGRADE_DIMENSIONS, context, existingAssetPath);
        }
        return decided(UpgradeStatus.NO_UPGRADE_NEEDED, context, existingAssetPath);
    }

    private UpgradeDecision decided(UpgradeStatus status, Map<String, Object> context, Path target) {
        UpgradeDecision decision = UpgradeDecision.of(status, context, dryRun);
        if (status.isUpgrade()) {
            log.debug(LoggingUtils.dryRun(dryRun, "Upgrade {} for {}: {}"), status, target, context);
        } else {
            log.debug("No upgrade ({}) for {}: {}", status, target, context);
        }
        return decision;
    }

    public boolean isDryRun() {
        return dryRun;
    }
}
