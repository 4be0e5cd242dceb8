package com.purchasingpower.repoagent.config;

import com.purchasingpower.repoagent.configuration.AppProperties;
import com.purchasingpower.repoagent.configuration.CompletionProperties;
import com.purchasingpower.repoagent.configuration.GithubProperties;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP clients for the completion provider and the repository host metadata API.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    @Bean
    public WebClient completionWebClient(WebClient.Builder builder, AppProperties appProperties) {
        CompletionProperties props = appProperties.getCompletion();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(props.getResponseTimeout());

        WebClient.Builder configured = builder.clone()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("HTTP-Referer", props.getReferer())
                .defaultHeader("X-Title", props.getTitle())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                        .build());
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey());
        }
        return configured.build();
    }

    @Bean
    public WebClient githubWebClient(WebClient.Builder builder, AppProperties appProperties) {
        GithubProperties props = appProperties.getGithub();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(props.getTimeout());

        WebClient.Builder configured = builder.clone()
                .baseUrl(props.getApiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github.v3+json");
        if (props.getToken() != null && !props.getToken().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getToken());
        }
        return configured.build();
    }
}
