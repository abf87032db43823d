package com.sandkev.scrobbler.config;

import com.sandkev.scrobbler.lastfm.LastFmRequestSigner;
import com.sandkev.scrobbler.lastfm.LastFmSignedClient;
import com.sandkev.scrobbler.lastfm.LastFmSignedClientImpl;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties({
        LastFmClientConfig.LastFmClientProperties.class,
        LastFmClientConfig.LastFmImportProperties.class
})
@RequiredArgsConstructor
public class LastFmClientConfig {

    private final LastFmClientProperties props;

    @Bean("lastFmWebClient")
    @Qualifier("lastFmWebClient")
    public WebClient lastFmWebClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    public LastFmRequestSigner lastFmRequestSigner() {
        return new LastFmRequestSigner(props.apiKey(), props.secret());
    }

    @Bean
    public LastFmSignedClient lastFmSignedClient(
            @Qualifier("lastFmWebClient") WebClient lastFmWebClient,
            LastFmRequestSigner signer
    ) {
        return new LastFmSignedClientImpl(lastFmWebClient, signer, props.baseUrl());
    }

    @ConfigurationProperties("lastfm.client")
    public record LastFmClientProperties(
            String baseUrl,     // e.g. https://ws.audioscrobbler.com/2.0/
            String authUrl,     // e.g. https://www.last.fm/api/auth/
            String apiKey,
            String secret,      // shared secret, only used for signing
            String sessionKey,  // printed by "authenticate"
            String user,        // whose history "import-history" reads
            int    timeoutMs
    ) {}

    @ConfigurationProperties("lastfm.import")
    public record LastFmImportProperties(
            int      pageSize,
            Duration incrementalWindow,
            Duration retryBackoff,
            int      maxConsecutiveErrors
    ) {}
}
