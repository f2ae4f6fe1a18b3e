package com.llmdispatch.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Shared WebClient for outbound vendor calls. Connections are pooled by Reactor Netty;
 * adapters hold no connection state of their own between calls.
 */
@Configuration
public class WebClientConfiguration {

    private final DispatchProperties properties;

    public WebClientConfiguration(DispatchProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        DispatchProperties.HttpConfig http = properties.getHttp();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
                .responseTimeout(http.getResponseTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
