package com.incoresoft.presenceTracker.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

@Configuration
public class HttpClientConfig {
    @Bean
    public RestTemplate faceApiRestTemplate(FaceApiProps props, RestTemplateBuilder builder) {
        ClientHttpRequestInterceptor auth = (req, body, exec) -> {
            if (StringUtils.hasText(props.getToken())) {
                req.getHeaders().add("Authorization", "Bearer " + props.getToken());
            }
            req.getHeaders().add("Accept", "application/json");
            return exec.execute(req, body);
        };
        // frame processing must stay short, so no long waits on the detector
        return builder
                .setConnectTimeout(Duration.ofSeconds(2))
                .setReadTimeout(Duration.ofSeconds(10))
                .additionalInterceptors(List.of(auth))
                .build();
    }
}
