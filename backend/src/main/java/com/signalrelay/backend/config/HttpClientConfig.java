package com.signalrelay.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate per remote party so each carries its own connect/read timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate oandaRestTemplate(OandaProperties properties) {
        return restTemplate(properties.getConnectTimeoutMs(), properties.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate relayRestTemplate(RelayProperties properties) {
        return restTemplate(properties.getConnectTimeoutMs(), properties.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate discordRestTemplate(NotificationProperties properties) {
        return restTemplate(properties.getTimeoutMs(), properties.getTimeoutMs());
    }

    private static RestTemplate restTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
