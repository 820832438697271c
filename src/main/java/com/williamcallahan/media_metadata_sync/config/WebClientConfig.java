/**
 * Configuration for WebClient
 * - Defines the shared WebClient builder used by the catalog and media-server clients
 * - Applies the configured network timeout to connect, read, write and response phases
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Timeouts come from app.network.timeout
     * - In-memory buffer raised to 32MB so original-size artwork fits
     *
     * @param properties application properties
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(MetadataSyncProperties properties) {
        Duration timeout = properties.getNetwork().getTimeout();
        long timeoutMillis = Math.max(1L, timeout.toMillis());
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeoutMillis))
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(timeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(32 * 1024 * 1024))
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
