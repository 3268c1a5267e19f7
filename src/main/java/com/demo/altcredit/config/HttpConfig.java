package com.demo.altcredit.config;

import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/** HTTP client for the model registry. */
@Configuration
public class HttpConfig {

    @Bean
    public RestTemplate restTemplate(@Value("${model.connect-timeout-ms:5000}") int connectTimeoutMs,
                                     @Value("${model.read-timeout-ms:8000}") int readTimeoutMs) {
        CloseableHttpClient client = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultSocketConfig(SocketConfig.custom()
                                .setSoTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                                .build())
                        .build())
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(client);
        f.setConnectTimeout(connectTimeoutMs);
        return new RestTemplate(f);
    }
}
