package io.github.riemr.mobilepost.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate importFeedRestTemplate(RestTemplateBuilder builder,
                                               @Value("${mobilepost.import.connect-timeout:5s}") Duration connectTimeout,
                                               @Value("${mobilepost.import.read-timeout:30s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
