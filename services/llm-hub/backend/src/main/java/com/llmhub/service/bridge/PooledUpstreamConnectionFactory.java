package com.llmhub.service.bridge;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HttpClient 5 연결 풀 기반 업스트림 연결 생성
 * - 최대 10 연결, 단일 백엔드이므로 route 당 5
 */
public class PooledUpstreamConnectionFactory implements UpstreamConnectionFactory {

    static final int MAX_CONNECTIONS = 10;
    static final int MAX_CONNECTIONS_PER_ROUTE = 5;

    private final Duration timeout;

    public PooledUpstreamConnectionFactory(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public UpstreamConnection create() {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(MAX_CONNECTIONS);
        connectionManager.setDefaultMaxPerRoute(MAX_CONNECTIONS_PER_ROUTE);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(timeout))
                .setSocketTimeout(Timeout.of(timeout))
                .build());

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.of(timeout))
                .setResponseTimeout(Timeout.of(timeout))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();

        // destroy() 가 HttpClient(및 풀)를 닫는다
        HttpComponentsClientHttpRequestFactory requestFactory =
                new HttpComponentsClientHttpRequestFactory(httpClient);

        return new UpstreamConnection(new RestTemplate(requestFactory), requestFactory);
    }
}
