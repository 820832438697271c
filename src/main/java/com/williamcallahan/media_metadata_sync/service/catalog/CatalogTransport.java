/**
 * Black-box access to the remote catalog
 * Implementations make exactly one attempt per call and never retry
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

import java.util.Map;

public interface CatalogTransport {

    /**
     * Issues one JSON request
     *
     * @param endpoint path relative to the catalog base URL, e.g. "/movie/603"
     * @param params   query parameters
     * @return the raw response, whatever its status
     * @throws CatalogTransportException when no response was received
     */
    CatalogResponse fetch(String endpoint, Map<String, String> params);

    /**
     * Downloads one image
     *
     * @param imagePath catalog image path, e.g. "/abc.jpg"
     * @return the raw response, whatever its status
     * @throws CatalogTransportException when no response was received
     */
    CatalogResponse download(String imagePath);
}
