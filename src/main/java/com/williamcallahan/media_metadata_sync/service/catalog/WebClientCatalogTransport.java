/**
 * TMDb v3 transport built on WebClient
 *
 * @author William Callahan
 *
 * Features:
 * - Adds api_key, language and region to every JSON request
 * - Returns status, body and Retry-After for every response instead of raising on 4xx/5xx
 * - Downloads original-size images from the image CDN
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

@Slf4j
@Component
public class WebClientCatalogTransport implements CatalogTransport {

    private final WebClient webClient;
    private final MetadataSyncProperties.Tmdb tmdb;
    private final Duration timeout;

    public WebClientCatalogTransport(WebClient.Builder webClientBuilder, MetadataSyncProperties properties) {
        this.webClient = webClientBuilder.build();
        this.tmdb = properties.getTmdb();
        this.timeout = properties.getNetwork().getTimeout();
    }

    @Override
    public CatalogResponse fetch(String endpoint, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(tmdb.getBaseUrl()).path(endpoint);
        if (tmdb.getApiKey() != null) {
            builder.queryParam("api_key", tmdb.getApiKey());
        }
        if (params == null || !params.containsKey("language")) {
            builder.queryParam("language", tmdb.getLanguage());
        }
        if (tmdb.getRegion() != null && (params == null || !params.containsKey("region"))) {
            builder.queryParam("region", tmdb.getRegion());
        }
        if (params != null) {
            params.forEach((k, v) -> {
                if (v != null) {
                    builder.queryParam(k, v);
                }
            });
        }
        return exchange(builder.encode().build().toUri());
    }

    @Override
    public CatalogResponse download(String imagePath) {
        String base = tmdb.getImageBaseUrl();
        String path = imagePath.startsWith("/") ? imagePath : "/" + imagePath;
        return exchange(URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) + path : base + path));
    }

    private CatalogResponse exchange(URI uri) {
        try {
            CatalogResponse response = webClient.get()
                .uri(uri)
                .exchangeToMono(this::toCatalogResponse)
                .block(timeout.plusSeconds(1));
            if (response == null) {
                throw new CatalogTransportException("No response from " + uri.getPath(), null);
            }
            return response;
        } catch (CatalogTransportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CatalogTransportException("Request to " + uri.getPath() + " failed: " + e.getMessage(), e);
        }
    }

    private Mono<CatalogResponse> toCatalogResponse(ClientResponse clientResponse) {
        int status = clientResponse.statusCode().value();
        String retryAfter = clientResponse.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        return clientResponse.bodyToMono(byte[].class)
            .map(bytes -> new CatalogResponse(status, bytes, retryAfter))
            .defaultIfEmpty(new CatalogResponse(status, new byte[0], retryAfter));
    }
}
