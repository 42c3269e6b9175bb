package com.gpuopt.application.payment;

import com.gpuopt.domain.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed-rate conversion between USD and the handful of currencies a checkout may be priced in.
 * The table is a point-in-time approximation, not a live feed.
 */
public final class CurrencyConverter {

    public static final String USD = "USD";

    private static final Map<String, BigDecimal> USD_RATES = Map.of(
            "USD", BigDecimal.ONE,
            "EUR", new BigDecimal("1.1"),
            "GBP", new BigDecimal("1.25"),
            "CAD", new BigDecimal("0.75"),
            "AUD", new BigDecimal("0.65"),
            "JPY", new BigDecimal("0.007"),
            "INR", new BigDecimal("0.012"),
            "NGN", new BigDecimal("0.0024")
    );

    /**
     * @throws ValidationException for currencies outside the table
     */
    public BigDecimal toUsd(BigDecimal amount, String currency) {
        return amount.multiply(rate(currency)).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Prices a USD amount in {@code currency}, rounded up to the cent so that converting
     * the result back never comes out below {@code usd}.
     *
     * @throws ValidationException for currencies outside the table
     */
    public BigDecimal fromUsd(BigDecimal usd, String currency) {
        return usd.divide(rate(currency), 2, RoundingMode.CEILING);
    }

    /**
     * Whether {@code amount} in {@code currency} is worth at least {@code usd}, compared before rounding.
     *
     * @throws ValidationException for currencies outside the table
     */
    public boolean covers(BigDecimal amount, String currency, BigDecimal usd) {
        return amount.multiply(rate(currency)).compareTo(usd) >= 0;
    }

    private static BigDecimal rate(String currency) {
        String code = currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
        BigDecimal rate = USD_RATES.get(code);
        if (rate == null) {
            throw new ValidationException("Unsupported currency for USD conversion: " + currency);
        }
        return rate;
    }

    public boolean supports(String currency) {
        return currency != null && USD_RATES.containsKey(currency.trim().toUpperCase(Locale.ROOT));
    }
}
