package com.deepansh.honeypot.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Outbound HTTP is Spring's RestClient over a pooled Apache HttpClient 5.
 *
 * Two builders with separate pools:
 * - llmRestClientBuilder: chat-completions calls, generous read timeout
 *   since a persona reply can take several seconds
 * - reporterRestClientBuilder: the evaluator push, bounded by
 *   honeypot.reporter.* timeouts; this call happens after finalization
 *   and must not stall a request thread for long
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    private static final int LLM_CONNECT_TIMEOUT_MS = 10_000;
    private static final int LLM_READ_TIMEOUT_MS = 60_000;

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder() {
        log.info("LLM HttpClient configured [connectTimeoutMs={}, readTimeoutMs={}]",
                LLM_CONNECT_TIMEOUT_MS, LLM_READ_TIMEOUT_MS);
        return RestClient.builder().requestFactory(requestFactory(LLM_CONNECT_TIMEOUT_MS, LLM_READ_TIMEOUT_MS, 20));
    }

    @Bean("reporterRestClientBuilder")
    public RestClient.Builder reporterRestClientBuilder(HoneypotProperties properties) {
        HoneypotProperties.Reporter reporter = properties.getReporter();
        log.info("Reporter HttpClient configured [connectTimeoutMs={}, readTimeoutMs={}]",
                reporter.getConnectTimeoutMs(), reporter.getReadTimeoutMs());
        return RestClient.builder().requestFactory(
                requestFactory(reporter.getConnectTimeoutMs(), reporter.getReadTimeoutMs(), 5));
    }

    private HttpComponentsClientHttpRequestFactory requestFactory(int connectTimeoutMs,
                                                                  int readTimeoutMs,
                                                                  int maxConnections) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                        .build())
                .build();

        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }
}
