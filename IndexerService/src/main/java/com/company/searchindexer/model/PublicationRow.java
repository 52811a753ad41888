package com.company.searchindexer.model;

import java.util.Collections;
import java.util.Map;

/**
 * Fila de publicación con todos los JOINs ya resueltos, tal y como la devuelve MySQL.
 * Los agregados multi-valor llegan como cadenas separadas por comas (GROUP_CONCAT).
 */
public class PublicationRow {

    private final Map<String, Object> columns;

    public PublicationRow(Map<String, Object> columns) {
        this.columns = columns == null ? Collections.emptyMap() : columns;
    }

    public Object get(String column) {
        return columns.get(column);
    }

    public String getString(String column) {
        Object value = columns.get(column);
        return value == null ? null : value.toString();
    }
}
