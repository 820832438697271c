/**
 * Posters and backdrops offered for one title or season
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

import com.williamcallahan.media_metadata_sync.types.AssetCandidate;

import java.util.List;

public record CatalogImages(List<AssetCandidate> posters, List<AssetCandidate> backdrops) {

    public static final CatalogImages EMPTY = new CatalogImages(List.of(), List.of());

    public CatalogImages {
        posters = posters == null ? List.of() : List.copyOf(posters);
        backdrops = backdrops == null ? List.of() : List.copyOf(backdrops);
    }
}
