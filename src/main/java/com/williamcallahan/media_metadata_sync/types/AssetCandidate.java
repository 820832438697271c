/**
 * Image offered by the remote catalog for one asset slot
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

/**
 * @param filePath    catalog-relative image path, e.g. "/abc.jpg"
 * @param language    ISO 639-1 language or null for language-neutral images
 * @param voteAverage community vote average
 * @param width       pixel width reported by the catalog
 * @param height      pixel height reported by the catalog
 */
public record AssetCandidate(String filePath, String language, double voteAverage, int width, int height) {

    public long area() {
        return (long) width * (long) height;
    }
}
