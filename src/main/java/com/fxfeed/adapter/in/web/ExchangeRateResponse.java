package com.fxfeed.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fxfeed.domain.model.ExchangeRate;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO for exchange rate query responses
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExchangeRateResponse(
        String status,
        String message,
        List<RateEntry> rates
) {
    public static ExchangeRateResponse success(List<ExchangeRate> rates) {
        return new ExchangeRateResponse("success", null, rates.stream().map(RateEntry::from).toList());
    }

    public static ExchangeRateResponse error(String message) {
        return new ExchangeRateResponse("error", message, null);
    }

    public record RateEntry(
            String currency,
            int amount,
            BigDecimal rate,
            String referenceCurrency
    ) {
        static RateEntry from(ExchangeRate rate) {
            return new RateEntry(
                    rate.getCurrency().getCode(),
                    rate.getAmount(),
                    rate.getRate(),
                    rate.getReferenceCurrency().getCode()
            );
        }
    }
}
