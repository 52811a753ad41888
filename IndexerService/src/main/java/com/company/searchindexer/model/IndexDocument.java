package com.company.searchindexer.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Documento disperso para Elasticsearch: un campo sin valor no existe, nunca vale null.
 * Los campos array están siempre presentes, aunque vengan vacíos.
 */
public final class IndexDocument {

    private final Map<String, Object> fields;

    private IndexDocument(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Object getId() {
        return fields.get("id");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexDocument)) {
            return false;
        }
        return fields.equals(((IndexDocument) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static final class Builder {

        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String field, Object value) {
            if (value instanceof IndexDocument) {
                return putObject(field, (IndexDocument) value);
            }
            if (value != null) {
                fields.put(field, value);
            }
            return this;
        }

        public Builder putArray(String field, Collection<?> values) {
            List<Object> array = new ArrayList<>();
            if (values != null) {
                for (Object value : values) {
                    if (value instanceof IndexDocument) {
                        array.add(((IndexDocument) value).asMap());
                    } else if (value != null) {
                        array.add(value);
                    }
                }
            }
            fields.put(field, Collections.unmodifiableList(array));
            return this;
        }

        // Un objeto anidado sin ningún campo se omite
        public Builder putObject(String field, IndexDocument nested) {
            if (nested != null && !nested.isEmpty()) {
                fields.put(field, nested.asMap());
            }
            return this;
        }

        public IndexDocument build() {
            return new IndexDocument(new LinkedHashMap<>(fields));
        }
    }
}
