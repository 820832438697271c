/**
 * One catalog search result, reduced to the fields used for ranking
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

import java.util.Comparator;

public record SearchHit(String id, long voteCount, double popularity) {

    /**
     * Best hit first: vote count, then popularity, both descending
     */
    public static final Comparator<SearchHit> BEST_FIRST = Comparator
        .comparingLong(SearchHit::voteCount)
        .thenComparingDouble(SearchHit::popularity)
        .reversed();
}
