/**
 * Picks the best catalog image for an asset slot
 *
 * @author William Callahan
 *
 * Features:
 * - Narrows to the first language in the preference list that has any image, else keeps all
 * - Tier 1: preferred vote and preferred dimensions, best by (vote, area)
 * - Tier 2: relaxed vote and minimum dimensions, best by (vote, area)
 * - Tier 3: minimum dimensions only, best by area
 * - Tier 4: largest image of the considered set
 */
package com.williamcallahan.media_metadata_sync.service.image;

import com.williamcallahan.media_metadata_sync.types.AssetCandidate;
import com.williamcallahan.media_metadata_sync.types.AssetQualityPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Component
public class AssetSelector {

    private static final Comparator<AssetCandidate> BY_VOTE_THEN_AREA = Comparator
        .comparingDouble(AssetCandidate::voteAverage)
        .thenComparingLong(AssetCandidate::area);
    private static final Comparator<AssetCandidate> BY_AREA = Comparator.comparingLong(AssetCandidate::area);

    /**
     * @param candidates        images offered by the catalog
     * @param preferredLanguage first-choice language, null for no preference
     * @param fallbackLanguages further languages in order
     * @param policy            vote and dimension thresholds
     * @return the chosen candidate, empty only when there are no candidates
     */
    public Optional<AssetCandidate> selectBest(List<AssetCandidate> candidates, String preferredLanguage,
                                               List<String> fallbackLanguages, AssetQualityPolicy policy) {
        if (candidates == null || candidates.isEmpty()) {
            log.debug("No images available to select from");
            return Optional.empty();
        }
        List<AssetCandidate> considered = byLanguage(candidates, preferredLanguage, fallbackLanguages);

        Optional<AssetCandidate> best = considered.stream()
            .filter(c -> c.voteAverage() >= policy.preferredVote()
                && c.width() >= policy.preferredWidth() && c.height() >= policy.preferredHeight())
            .max(BY_VOTE_THEN_AREA);
        if (best.isPresent()) {
            log.debug("Selected preferred-quality image {}", best.get().filePath());
            return best;
        }

        best = considered.stream()
            .filter(c -> c.voteAverage() >= policy.relaxedVote()
                && c.width() >= policy.minWidth() && c.height() >= policy.minHeight())
            .max(BY_VOTE_THEN_AREA);
        if (best.isPresent()) {
            log.debug("Selected relaxed-quality image {}", best.get().filePath());
            return best;
        }

        best = considered.stream()
            .filter(c -> c.width() >= policy.minWidth() && c.height() >= policy.minHeight())
            .max(BY_AREA);
        if (best.isPresent()) {
            log.debug("Selected minimum-size image {}", best.get().filePath());
            return best;
        }

        best = considered.stream().max(BY_AREA);
        best.ifPresent(c -> log.debug("Selected largest available image {} as final fallback", c.filePath()));
        return best;
    }

    static List<AssetCandidate> byLanguage(List<AssetCandidate> candidates, String preferredLanguage,
                                           List<String> fallbackLanguages) {
        List<String> priority = new ArrayList<>();
        if (preferredLanguage != null) {
            priority.add(preferredLanguage);
        }
        if (fallbackLanguages != null) {
            fallbackLanguages.stream().filter(Objects::nonNull).forEach(priority::add);
        }
        for (String language : priority) {
            List<AssetCandidate> matching = candidates.stream()
                .filter(c -> language.equalsIgnoreCase(c.language() == null ? "" : c.language()))
                .toList();
            if (!matching.isEmpty()) {
                return matching;
            }
        }
        return candidates;
    }
}
