package com.company.searchindexer.service;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normaliza importes a un único valor numérico.
 * Acepta números o cadenas con formato local: '.' separa miles, ',' separa decimales,
 * con símbolo de moneda opcional delante ({@code $3.900.000,50}).
 */
@Slf4j
public final class AmountParser {

    private static final Pattern LEADING_CURRENCY = Pattern.compile("^[^0-9,.\\-+]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AmountParser() {
    }

    /**
     * @return el importe, o vacío si la entrada está vacía, es cero o no se puede interpretar
     */
    public static Optional<Double> parse(Object rawAmount) {
        if (rawAmount == null) {
            return Optional.empty();
        }
        if (rawAmount instanceof Number) {
            double value = ((Number) rawAmount).doubleValue();
            return value == 0d ? Optional.empty() : Optional.of(value);
        }

        String amount = rawAmount.toString().trim();
        if (amount.isEmpty() || "0".equals(amount)) {
            return Optional.empty();
        }

        String cleaned = WHITESPACE.matcher(amount).replaceAll("");
        cleaned = LEADING_CURRENCY.matcher(cleaned).replaceFirst("");
        cleaned = cleaned.replace(".", "").replace(',', '.');

        try {
            double value = new BigDecimal(cleaned).doubleValue();
            log.debug("Parsed monto: '{}' -> {}", amount, value);
            return Optional.of(value);
        } catch (NumberFormatException e) {
            log.warn("Failed to parse monto '{}' -> cleaned: '{}'", amount, cleaned);
            return Optional.empty();
        }
    }
}
