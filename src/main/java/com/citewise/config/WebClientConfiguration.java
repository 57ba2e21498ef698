package com.citewise.config;

import com.citewise.http.BrowserHeaders;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for outbound HTTP requests.
 *
 * Two clients are exposed:
 * - the primary client talks JSON to language-model providers
 * - the browser client scrapes the search engine and arbitrary pages with a browser-like header set
 */
@Configuration
public class WebClientConfiguration {

    private static final int BROWSER_MAX_IN_MEMORY_BYTES = 2 * 1024 * 1024;

    private final CitewiseProperties properties;

    public WebClientConfiguration(CitewiseProperties properties) {
        this.properties = properties;
    }

    @Bean
    @Primary
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getLlm().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public WebClient browserWebClient() {
        // gzip/deflate bodies are decompressed by Netty before they reach the parsers
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeaders(BrowserHeaders::apply)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(BROWSER_MAX_IN_MEMORY_BYTES))
                .build();
    }
}
