package com.fxfeed.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Exchange Rate - quotation declared by a rate feed
 * {@code amount} units of {@code currency} are worth {@code rate} units of {@code referenceCurrency}
 */
@Value
public class ExchangeRate {
    Currency currency;
    int amount;
    BigDecimal rate;
    Currency referenceCurrency;  // implicit in the feed, taken from configuration

    public ExchangeRate(Currency currency, int amount, BigDecimal rate, Currency referenceCurrency) {
        if (currency == null) {
            throw new IllegalArgumentException("Currency cannot be null");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
        if (rate == null || rate.signum() < 0) {
            throw new IllegalArgumentException("Rate must be non-negative: " + rate);
        }
        if (referenceCurrency == null) {
            throw new IllegalArgumentException("Reference currency cannot be null");
        }
        this.currency = currency;
        this.amount = amount;
        this.rate = rate;
        this.referenceCurrency = referenceCurrency;
    }

    @Override
    public String toString() {
        return amount + " " + currency + "/" + referenceCurrency + "=" + rate.toPlainString();
    }
}
