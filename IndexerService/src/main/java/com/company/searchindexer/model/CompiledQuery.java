package com.company.searchindexer.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consulta bool de Elasticsearch: cláusulas must / filter / should.
 * El filtro de visibilidad se añade siempre al construirla, no hay forma de pedir publicaciones ocultas.
 */
@Getter
public final class CompiledQuery {

    public static final Map<String, Object> VISIBLE_CLAUSE = term("visible", true);

    private final List<Map<String, Object>> must;
    private final List<Map<String, Object>> filter;
    private final List<Map<String, Object>> should;

    private CompiledQuery(List<Map<String, Object>> must, List<Map<String, Object>> filter,
                          List<Map<String, Object>> should) {
        this.must = Collections.unmodifiableList(must);
        this.filter = Collections.unmodifiableList(filter);
        this.should = Collections.unmodifiableList(should);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Cuerpo de la clave {@code query} de una petición _search.
     */
    public Map<String, Object> toDsl() {
        Map<String, Object> bool = new LinkedHashMap<>();
        if (!must.isEmpty()) {
            bool.put("must", must);
        }
        bool.put("filter", filter);
        if (!should.isEmpty()) {
            bool.put("should", should);
            bool.put("minimum_should_match", 1);
        }
        return Map.of("bool", bool);
    }

    public static Map<String, Object> term(String field, Object value) {
        return Map.of("term", Map.of(field, value));
    }

    public static Map<String, Object> terms(String field, List<?> values) {
        return Map.of("terms", Map.of(field, List.copyOf(values)));
    }

    public static Map<String, Object> wildcardContains(String field, String text) {
        return Map.of("wildcard", Map.of(field, "*" + text + "*"));
    }

    public static Map<String, Object> range(String field, Map<String, Object> bounds) {
        return Map.of("range", Map.of(field, Map.copyOf(bounds)));
    }

    @Override
    public String toString() {
        return toDsl().toString();
    }

    public static final class Builder {

        private final List<Map<String, Object>> must = new ArrayList<>();
        private final List<Map<String, Object>> filter = new ArrayList<>();
        private final List<Map<String, Object>> should = new ArrayList<>();

        private Builder() {
        }

        public Builder must(Map<String, Object> clause) {
            must.add(clause);
            return this;
        }

        public Builder filter(Map<String, Object> clause) {
            filter.add(clause);
            return this;
        }

        public Builder should(Map<String, Object> clause) {
            should.add(clause);
            return this;
        }

        public CompiledQuery build() {
            List<Map<String, Object>> filters = new ArrayList<>(filter);
            filters.add(VISIBLE_CLAUSE);
            return new CompiledQuery(new ArrayList<>(must), filters, new ArrayList<>(should));
        }
    }
}
