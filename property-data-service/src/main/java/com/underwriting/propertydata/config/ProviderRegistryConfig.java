package com.underwriting.propertydata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.propertydata.client.ClosingCorpProvider;
import com.underwriting.propertydata.client.EstatedProvider;
import com.underwriting.propertydata.client.HudFmrProvider;
import com.underwriting.propertydata.client.MarketplaceCompsProvider;
import com.underwriting.propertydata.client.RentcastProvider;
import com.underwriting.propertydata.client.RentometerProvider;
import com.underwriting.propertydata.config.WebClientConfig.ProviderWebClientFactory;
import com.underwriting.propertydata.provider.MockPropertyProvider;
import com.underwriting.propertydata.registry.ProviderRegistry;
import com.underwriting.propertydata.registry.ProviderTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds the {@link ProviderRegistry} once at startup. An adapter is registered only when
 * its credentials and base URL are configured; HUD FMR is open data and needs only a URL.
 * Registration order inside a tier is the precedence order.
 */
@Configuration
public class ProviderRegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistryConfig.class);

    @Value("${providers.timeout-seconds:10}")
    private long timeoutSeconds;

    @Value("${providers.use-mock-if-unconfigured:true}")
    private boolean useMockIfUnconfigured;

    @Value("${providers.rentcast.api-key:}")
    private String rentcastApiKey;

    @Value("${providers.rentcast.base-url:https://api.rentcast.io/v1}")
    private String rentcastBaseUrl;

    @Value("${providers.estated.api-key:}")
    private String estatedApiKey;

    @Value("${providers.estated.base-url:https://apis.estated.com/v4}")
    private String estatedBaseUrl;

    @Value("${providers.rentometer.api-key:}")
    private String rentometerApiKey;

    @Value("${providers.rentometer.base-url:https://www.rentometer.com/api/v1}")
    private String rentometerBaseUrl;

    @Value("${providers.closingcorp.api-key:}")
    private String closingCorpApiKey;

    @Value("${providers.closingcorp.base-url:}")
    private String closingCorpBaseUrl;

    @Value("${providers.hud-fmr.api-key:}")
    private String hudApiKey;

    @Value("${providers.hud-fmr.base-url:https://www.huduser.gov/hudapi/public}")
    private String hudBaseUrl;

    @Value("${providers.hud-fmr.cache-ttl-minutes:720}")
    private long hudCacheTtlMinutes;

    @Value("${providers.hud-fmr.cache-max-zips:5000}")
    private int hudCacheMaxZips;

    @Value("${providers.marketplace.enabled:false}")
    private boolean marketplaceEnabled;

    @Value("${providers.marketplace.api-key:}")
    private String marketplaceApiKey;

    @Value("${providers.marketplace.base-url:}")
    private String marketplaceBaseUrl;

    @Value("${providers.marketplace.timeout-seconds:10}")
    private long marketplaceTimeoutSeconds;

    @Value("${providers.marketplace.max-results:15}")
    private int marketplaceMaxResults;

    @Value("${providers.marketplace.max-retries:2}")
    private int marketplaceMaxRetries;

    @Value("${providers.marketplace.backoff-millis:750}")
    private long marketplaceBackoffMillis;

    @Bean
    public ProviderRegistry providerRegistry(ProviderWebClientFactory clients, ObjectMapper objectMapper, Clock clock) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        ProviderRegistry.Builder builder = ProviderRegistry.builder()
            .useFallbackIfUnconfigured(useMockIfUnconfigured)
            .fallback(new MockPropertyProvider(clock), timeout);

        if (configured(rentcastApiKey, rentcastBaseUrl)) {
            builder.register(new RentcastProvider(clients.create(rentcastBaseUrl), objectMapper, clock, rentcastApiKey),
                ProviderTier.COMMERCIAL, timeout);
        }
        if (configured(estatedApiKey, estatedBaseUrl)) {
            builder.register(new EstatedProvider(clients.create(estatedBaseUrl), objectMapper, clock, estatedApiKey),
                ProviderTier.COMMERCIAL, timeout);
        }
        if (configured(rentometerApiKey, rentometerBaseUrl)) {
            builder.register(new RentometerProvider(clients.create(rentometerBaseUrl), objectMapper, clock, rentometerApiKey),
                ProviderTier.COMMERCIAL, timeout);
        }
        if (configured(closingCorpApiKey, closingCorpBaseUrl)) {
            builder.register(new ClosingCorpProvider(clients.create(closingCorpBaseUrl), objectMapper, clock, closingCorpApiKey),
                ProviderTier.COMMERCIAL, timeout);
        }
        if (!isBlank(hudBaseUrl)) {
            builder.register(new HudFmrProvider(clients.create(hudBaseUrl), objectMapper, clock, hudApiKey,
                    Duration.ofMinutes(hudCacheTtlMinutes), hudCacheMaxZips),
                ProviderTier.OPEN_DATA, timeout);
        }
        if (marketplaceEnabled) {
            if (isBlank(marketplaceBaseUrl)) {
                log.warn("Marketplace comps enabled but no base-url configured, skipping. provider={}",
                    MarketplaceCompsProvider.ID);
            } else {
                Duration attemptTimeout = Duration.ofSeconds(marketplaceTimeoutSeconds);
                builder.register(new MarketplaceCompsProvider(clients.create(marketplaceBaseUrl), objectMapper, clock,
                        marketplaceApiKey, attemptTimeout, marketplaceMaxResults, marketplaceMaxRetries,
                        Duration.ofMillis(marketplaceBackoffMillis)),
                    ProviderTier.COMPS, retryBudget(attemptTimeout));
            }
        }
        return builder.build();
    }

    /** Room for every attempt plus its backoff; the global deadline still caps it. */
    private Duration retryBudget(Duration attemptTimeout) {
        Duration budget = attemptTimeout.multipliedBy(marketplaceMaxRetries + 1L);
        for (int attempt = 0; attempt < marketplaceMaxRetries; attempt++) {
            budget = budget.plusMillis(marketplaceBackoffMillis << attempt);
        }
        return budget;
    }

    private static boolean configured(String apiKey, String baseUrl) {
        return !isBlank(apiKey) && !isBlank(baseUrl);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
