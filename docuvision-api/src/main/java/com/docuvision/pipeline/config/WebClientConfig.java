package com.docuvision.pipeline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient ckanWebClient(@Value("${docuvision.ckan.base-url:http://localhost:5000}") String baseUrl,
                                   @Value("${docuvision.ckan.api-token:}") String apiToken,
                                   @Value("${docuvision.ckan.timeout-seconds:100}") long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (apiToken != null && !apiToken.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, apiToken);
        }
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    /**
     * Client for arbitrary document URLs found in manifests. No base URL; redirects are
     * followed since publication portals commonly redirect to a file store.
     */
    @Bean
    public WebClient fetchWebClient(@Value("${docuvision.fetch.timeout-seconds:30}") long timeoutSeconds) {
        HttpClient httpClient = HttpClient.create().followRedirect(true);
        if (timeoutSeconds > 0) {
            httpClient = httpClient.responseTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(exchangeStrategies())
                .build();
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
