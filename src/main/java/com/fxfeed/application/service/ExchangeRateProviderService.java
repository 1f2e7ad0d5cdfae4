package com.fxfeed.application.service;

import com.fxfeed.application.port.in.ExchangeRateQueryUseCase;
import com.fxfeed.application.port.out.RateFeedFetcher;
import com.fxfeed.domain.model.Currency;
import com.fxfeed.domain.model.ExchangeRate;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Use case implementation for exchange rate queries
 * Reads the common feed first and falls back to the other feed when it returned
 * fewer rates than currencies were requested. The count comparison is a heuristic:
 * it does not check which currencies are missing.
 */
@Slf4j
public class ExchangeRateProviderService implements ExchangeRateQueryUseCase {

    private final RateFeedFetcher feedFetcher;
    private final ExchangeRateExtractor extractor;
    private final String commonCurrenciesUrl;
    private final String otherCurrenciesUrl;

    public ExchangeRateProviderService(
            RateFeedFetcher feedFetcher,
            ExchangeRateExtractor extractor,
            String commonCurrenciesUrl,
            String otherCurrenciesUrl
    ) {
        if (feedFetcher == null || extractor == null) {
            throw new IllegalArgumentException("Feed fetcher and extractor are required");
        }
        if (commonCurrenciesUrl == null || commonCurrenciesUrl.isEmpty()) {
            throw new IllegalArgumentException("Common currencies URL cannot be null or empty");
        }
        if (otherCurrenciesUrl == null || otherCurrenciesUrl.isEmpty()) {
            throw new IllegalArgumentException("Other currencies URL cannot be null or empty");
        }
        this.feedFetcher = feedFetcher;
        this.extractor = extractor;
        this.commonCurrenciesUrl = commonCurrenciesUrl;
        this.otherCurrenciesUrl = otherCurrenciesUrl;
    }

    @Override
    public Future<List<ExchangeRate>> getRates(Collection<Currency> currencies) {
        if (currencies == null || currencies.isEmpty()) {
            return Future.succeededFuture(Collections.emptyList());
        }

        int requested = currencies.size();
        log.info("Fetching exchange rates for {} currencies", requested);

        return fetchAndExtract(commonCurrenciesUrl, currencies)
                .compose(commonRates -> {
                    log.info("Common feed provided {} of {} requested rates", commonRates.size(), requested);
                    if (requested <= commonRates.size()) {
                        return Future.succeededFuture(commonRates);
                    }

                    log.info("Querying other currencies feed");
                    return fetchAndExtract(otherCurrenciesUrl, currencies)
                            .map(otherRates -> {
                                log.info("Other feed provided {} rates", otherRates.size());
                                List<ExchangeRate> combined = new ArrayList<>(commonRates);
                                combined.addAll(otherRates);
                                return combined;
                            });
                })
                .onFailure(error -> log.error("Failed to get exchange rates: {}", error.getMessage()));
    }

    private Future<List<ExchangeRate>> fetchAndExtract(String url, Collection<Currency> currencies) {
        return feedFetcher.fetch(url)
                .map(content -> extractor.extract(content, currencies));
    }
}
