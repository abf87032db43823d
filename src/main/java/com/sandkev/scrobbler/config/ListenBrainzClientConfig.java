package com.sandkev.scrobbler.config;

import com.sandkev.scrobbler.listenbrainz.ListenBrainzClient;
import com.sandkev.scrobbler.listenbrainz.ListenBrainzClientImpl;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(ListenBrainzClientConfig.ListenBrainzClientProperties.class)
@RequiredArgsConstructor
public class ListenBrainzClientConfig {

    private final ListenBrainzClientProperties props;

    @Bean("listenBrainzWebClient")
    @Qualifier("listenBrainzWebClient")
    public WebClient listenBrainzWebClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .baseUrl(props.baseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Token " + props.userToken())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    public ListenBrainzClient listenBrainzClient(
            @Qualifier("listenBrainzWebClient") WebClient listenBrainzWebClient
    ) {
        return new ListenBrainzClientImpl(listenBrainzWebClient);
    }

    @ConfigurationProperties("listenbrainz.client")
    public record ListenBrainzClientProperties(
            String baseUrl,            // e.g. https://api.listenbrainz.org
            String userToken,
            int    timeoutMs,
            int    maxBodyBytes,       // MAX_LISTEN_SIZE of the submit-listens endpoint
            int    assumedListenBytes, // first guess for the batch size, ~190-240 bytes without MBIDs
            int    batchGrowth
    ) {}
}
