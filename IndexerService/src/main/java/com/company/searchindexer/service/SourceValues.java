package com.company.searchindexer.service;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conversión de valores crudos de MySQL a valores aptos para el índice.
 */
public final class SourceValues {

    public static final DateTimeFormatter INDEX_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String ZERO_DATE_PREFIX = "0000-00-00";

    private SourceValues() {
    }

    /**
     * Fechas "cero" de MySQL, vacías o nulas se consideran ausentes.
     */
    public static String sanitizeDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().format(INDEX_DATE_TIME);
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay().format(INDEX_DATE_TIME);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(INDEX_DATE_TIME);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime().format(INDEX_DATE_TIME);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay().format(INDEX_DATE_TIME);
        }

        String date = value.toString().trim();
        if (date.isEmpty() || date.startsWith(ZERO_DATE_PREFIX) || "None".equals(date)) {
            return null;
        }
        return date;
    }

    /**
     * Parte un agregado GROUP_CONCAT de ids. Descarta fragmentos no numéricos y duplicados.
     */
    public static List<Long> splitIds(String aggregate) {
        Set<Long> ids = new LinkedHashSet<>();
        if (aggregate == null || aggregate.isBlank()) {
            return new ArrayList<>(ids);
        }
        for (String fragment : aggregate.split(",")) {
            String candidate = fragment.trim();
            if (isDigits(candidate)) {
                ids.add(Long.parseLong(candidate));
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * Parte un agregado de pares {@code id:descripcion}. Un id repetido conserva la primera descripción.
     */
    public static List<Map<String, Object>> splitTags(String aggregate) {
        Map<Long, Map<String, Object>> tags = new LinkedHashMap<>();
        if (aggregate == null || aggregate.isBlank()) {
            return new ArrayList<>(tags.values());
        }
        for (String fragment : aggregate.split(",")) {
            int separator = fragment.indexOf(':');
            if (separator < 0) {
                continue;
            }
            String id = fragment.substring(0, separator).trim();
            if (!isDigits(id)) {
                continue;
            }
            Map<String, Object> tag = new LinkedHashMap<>();
            tag.put("id", Long.parseLong(id));
            tag.put("descripcion", fragment.substring(separator + 1));
            tags.putIfAbsent(Long.parseLong(id), tag);
        }
        return new ArrayList<>(tags.values());
    }

    public static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        return "1".equals(text) || "true".equalsIgnoreCase(text);
    }

    public static double toDouble(Object value, double defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return new BigDecimal(value.toString().trim()).doubleValue();
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
