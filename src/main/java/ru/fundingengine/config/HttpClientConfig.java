package ru.fundingengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient httpClient(FundingConfig fundingConfig) {
        Timeout timeout = Timeout.ofMilliseconds(fundingConfig.getDiscovery().getFetchTimeoutMs());

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(timeout)
                .setSocketTimeout(timeout)
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(timeout)
                .build();

        log.info("[HttpClient] Created with timeout {}ms", fundingConfig.getDiscovery().getFetchTimeoutMs());

        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    //Pool for per-exchange fan-out, joined before any decision logic runs
    @Bean(destroyMethod = "shutdown")
    public ExecutorService fundingDataExecutor(FundingConfig fundingConfig) {
        AtomicInteger counter = new AtomicInteger(1);
        return Executors.newFixedThreadPool(fundingConfig.getDiscovery().getThreadPoolSize(), r -> {
            Thread thread = new Thread(r, "funding-data-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }
}
