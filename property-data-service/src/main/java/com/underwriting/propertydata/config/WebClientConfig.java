package com.underwriting.propertydata.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${providers.timeout-seconds:10}")
    private int timeoutSeconds;

    @Bean
    public ProviderWebClientFactory providerWebClientFactory() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutSeconds * 1_000L, Integer.MAX_VALUE))
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );
        ReactorClientHttpConnector connector = new ReactorClientHttpConnector(httpClient);

        return baseUrl -> WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(connector)
            .filter(loggingFilter())
            .build();
    }

    /** Logs outbound requests at debug with credentials masked. */
    static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitize(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }

    static String sanitize(String uri) {
        return uri.replaceAll("(?i)(api_key|apikey|token)=[^&]+", "$1=***");
    }

    /** One WebClient per provider base URL, all sharing the same connector and timeouts. */
    @FunctionalInterface
    public interface ProviderWebClientFactory {
        WebClient create(String baseUrl);
    }
}
