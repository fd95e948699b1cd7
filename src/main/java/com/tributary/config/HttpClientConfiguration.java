package com.tributary.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * HTTP client used for the blocking Gemini streaming calls.
 * Read timeouts are applied per request; only the connect timeout is fixed here.
 */
@Configuration
public class HttpClientConfiguration {

    private final TributaryProperties properties;

    public HttpClientConfiguration(TributaryProperties properties) {
        this.properties = properties;
    }

    @Bean
    public HttpClient geminiHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getTransport().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
