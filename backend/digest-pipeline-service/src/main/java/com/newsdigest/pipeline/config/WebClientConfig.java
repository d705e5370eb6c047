package com.newsdigest.pipeline.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Netty connector shared by all provider WebClients.
 * Socket-level timeouts only; per-attempt deadlines are enforced by the router.
 */
@Configuration
public class WebClientConfig {

    @Value("${digest.http.timeout.connect:10000}")
    private int connectTimeout;

    @Value("${digest.http.timeout.read:60000}")
    private int readTimeout;

    @Bean
    public ReactorClientHttpConnector providerHttpConnector() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
                .responseTimeout(Duration.ofMillis(readTimeout))
                .doOnConnected(conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(readTimeout, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(readTimeout, TimeUnit.MILLISECONDS))
                )
                .followRedirect(true);

        return new ReactorClientHttpConnector(httpClient);
    }
}
