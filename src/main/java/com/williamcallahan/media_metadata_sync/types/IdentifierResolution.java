/**
 * Outcome of resolving a media unit to its catalog identifier
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

import java.util.Optional;

public record IdentifierResolution(String externalId, Source source) {

    public enum Source {
        CACHE,
        EMBEDDED_ID,
        SEARCH,
        FAILED_CACHED,
        NOT_FOUND
    }

    public static IdentifierResolution resolved(String externalId, Source source) {
        return new IdentifierResolution(externalId, source);
    }

    public static IdentifierResolution notFound(Source source) {
        return new IdentifierResolution(null, source);
    }

    public boolean isFound() {
        return externalId != null;
    }

    public Optional<String> id() {
        return Optional.ofNullable(externalId);
    }
}
