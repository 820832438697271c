/**
 * Raw response handed back by a {@link CatalogTransport}
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

/**
 * @param statusCode HTTP status
 * @param body       response body, possibly empty, never null
 * @param retryAfter raw Retry-After header value, null when absent
 */
public record CatalogResponse(int statusCode, byte[] body, String retryAfter) {

    public CatalogResponse {
        body = body == null ? new byte[0] : body;
    }

    public static CatalogResponse ok(byte[] body) {
        return new CatalogResponse(200, body, null);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
