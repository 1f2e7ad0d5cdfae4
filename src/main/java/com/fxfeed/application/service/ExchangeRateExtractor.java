package com.fxfeed.application.service;

import com.fxfeed.domain.model.Currency;
import com.fxfeed.domain.model.ExchangeRate;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses pipe-delimited rate feeds
 * Record format: "name|label|amount|code|rate", e.g. "USA|dollar|1|USD|21,345"
 * Lines that do not match the format are skipped, never reported as errors
 */
@Slf4j
public class ExchangeRateExtractor {

    private static final int FIELD_COUNT = 5;
    private static final int AMOUNT_FIELD = 2;
    private static final int CODE_FIELD = 3;
    private static final int RATE_FIELD = 4;
    private static final int CODE_LENGTH = 3;

    private static final Pattern AMOUNT_PATTERN = Pattern.compile("[+-]?\\d+");
    // One optional decimal separator, '.' or ','; no exponent, no grouping
    private static final Pattern RATE_PATTERN = Pattern.compile("[+-]?(\\d+([.,]\\d*)?|[.,]\\d+)");

    private final Currency referenceCurrency;

    public ExchangeRateExtractor(Currency referenceCurrency) {
        if (referenceCurrency == null) {
            throw new IllegalArgumentException("Reference currency cannot be null");
        }
        this.referenceCurrency = referenceCurrency;
    }

    /**
     * Extract the rates of the requested currencies from feed content
     * @param content Feed body, must be non-empty
     * @param currencies Requested currencies, may be empty but not null
     * @return Rates in line order
     */
    public List<ExchangeRate> extract(String content, Collection<Currency> currencies) {
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("Content cannot be null or empty");
        }
        if (currencies == null) {
            throw new IllegalArgumentException("Currencies cannot be null");
        }

        Set<String> requestedCodes = currencies.stream()
                .map(Currency::getCode)
                .collect(Collectors.toSet());

        List<ExchangeRate> rates = new ArrayList<>();
        for (String line : content.split("\n", -1)) {
            String[] fields = line.split("\\|", -1);
            if (fields.length != FIELD_COUNT || fields[CODE_FIELD].length() != CODE_LENGTH) {
                continue;
            }
            if (!requestedCodes.contains(fields[CODE_FIELD])) {
                continue;
            }

            Integer amount = parseAmount(fields[AMOUNT_FIELD]);
            BigDecimal rate = parseRate(fields[RATE_FIELD]);
            if (amount == null || rate == null) {
                log.debug("Skipping unparsable record: {}", line);
                continue;
            }
            if (amount <= 0 || rate.signum() < 0) {
                log.debug("Skipping record with out-of-range values: {}", line);
                continue;
            }

            rates.add(new ExchangeRate(new Currency(fields[CODE_FIELD]), amount, rate, referenceCurrency));
        }

        log.debug("Extracted {} rates for {} requested currencies", rates.size(), requestedCodes.size());
        return rates;
    }

    private static Integer parseAmount(String field) {
        String value = field.trim();
        if (!AMOUNT_PATTERN.matcher(value).matches()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            // out of int range
            return null;
        }
    }

    private static BigDecimal parseRate(String field) {
        String value = field.trim();
        if (!RATE_PATTERN.matcher(value).matches()) {
            return null;
        }
        return new BigDecimal(value.replace(',', '.'));
    }
}
