package com.fxfeed.application.port.in;

import com.fxfeed.domain.model.Currency;
import com.fxfeed.domain.model.ExchangeRate;
import io.vertx.core.Future;

import java.util.Collection;
import java.util.List;

/**
 * Input port for exchange rate queries
 * Part of hexagonal architecture - defines what the application can do
 */
public interface ExchangeRateQueryUseCase {

    /**
     * Get the rates the source declares for the requested currencies.
     * Rates are never derived by inversion or cross-multiplication; currencies the
     * source does not publish are left out.
     * @param currencies Requested currencies; null or empty yields an empty list without any fetch
     * @return Future with rates in feed order (common feed first, then other feed)
     */
    Future<List<ExchangeRate>> getRates(Collection<Currency> currencies);
}
