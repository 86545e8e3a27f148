package com.climateplatform.collector.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Shared Reactor Netty settings for every source fetcher. Fetchers clone the auto-configured
 * {@code WebClient.Builder}, so the customizer below reaches all of them.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    private static final Pattern SECRET_PARAMS =
        Pattern.compile("(?i)(token|api_key|apikey)=[^&]+");

    @Bean
    public WebClientCustomizer collectorWebClientCustomizer(CollectorProperties properties) {
        CollectorProperties.Http http = properties.http();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, http.connectTimeoutMillis())
            .responseTimeout(Duration.ofSeconds(http.readTimeoutSeconds()))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(http.readTimeoutSeconds(), TimeUnit.SECONDS))
            );

        return builder -> builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .filter(loggingFilter());
    }

    static String maskSecrets(String uri) {
        return SECRET_PARAMS.matcher(uri).replaceAll("$1=***");
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), maskSecrets(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }
}
