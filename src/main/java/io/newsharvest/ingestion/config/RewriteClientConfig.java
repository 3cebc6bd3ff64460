package io.newsharvest.ingestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RewriteClientConfig {

    @Bean
    public RestTemplate rewriteRestTemplate(NewsConfig config) {
        Duration timeout = config.rewrite().timeout() != null ? config.rewrite().timeout() : Duration.ofSeconds(60);

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(config.http().connectTimeout());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        return new RestTemplate(requestFactory);
    }
}
