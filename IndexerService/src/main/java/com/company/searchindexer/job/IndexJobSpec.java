package com.company.searchindexer.job;

import com.company.searchindexer.exception.InvalidJobParametersException;
import common.indexer.dto.JobType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parámetros de un proceso de indexación, uno por tipo. Se validan al crear el proceso,
 * de forma que el executor siempre recibe parámetros completos.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class IndexJobSpec {

    public static final String PUBLICATION_ID = "publicacion_id";
    public static final String SCRAPER_ID = "scraper_id";
    public static final String SINCE = "since";

    private static final DateTimeFormatter SINCE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JobType type;

    protected IndexJobSpec(JobType type) {
        this.type = type;
    }

    /**
     * Parámetros tal y como se guardan en el registro del proceso.
     */
    public abstract Map<String, Object> toParameters();

    public static IndexJobSpec from(JobType type, Map<String, Object> params) {
        if (type == null) {
            throw new InvalidJobParametersException("Missing indexer type. Must be one of: " + JobType.validTags());
        }
        Map<String, Object> values = params == null ? Map.of() : params;
        switch (type) {
            case INDEX_PUBLICATION:
                return new SinglePublication(requireLong(values, PUBLICATION_ID));
            case INDEX_SCRAPER_PUBLICATIONS:
                return new ScraperSince(requireLong(values, SCRAPER_ID), requireSince(values));
            case SYNC_SINCE:
                return new SyncSince(requireSince(values));
            case INDEX_BULK:
                return new FullReindex();
            default:
                throw new InvalidJobParametersException("Unsupported indexer type: " + type.getTag());
        }
    }

    private static long requireLong(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            throw new InvalidJobParametersException("Missing required param: " + name);
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidJobParametersException("Param " + name + " must be an integer, got '" + value + "'", e);
        }
    }

    // Formato yyyy-MM-dd HH:mm:ss; una fecha sin hora se toma desde el inicio del día
    private static String requireSince(Map<String, Object> params) {
        Object value = params.get(SINCE);
        if (value == null || value.toString().isBlank()) {
            throw new InvalidJobParametersException("Missing required param: " + SINCE);
        }
        String since = value.toString().trim();
        try {
            return LocalDateTime.parse(since, SINCE_FORMAT).format(SINCE_FORMAT);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(since).atStartOfDay().format(SINCE_FORMAT);
            } catch (DateTimeParseException ignored) {
                throw new InvalidJobParametersException("Param since must be 'YYYY-MM-DD HH:MM:SS', got '" + since + "'", e);
            }
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class SinglePublication extends IndexJobSpec {
        private final long publicationId;

        public SinglePublication(long publicationId) {
            super(JobType.INDEX_PUBLICATION);
            this.publicationId = publicationId;
        }

        @Override
        public Map<String, Object> toParameters() {
            return Map.of(PUBLICATION_ID, publicationId);
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class ScraperSince extends IndexJobSpec {
        private final long scraperId;
        private final String since;

        public ScraperSince(long scraperId, String since) {
            super(JobType.INDEX_SCRAPER_PUBLICATIONS);
            this.scraperId = scraperId;
            this.since = since;
        }

        @Override
        public Map<String, Object> toParameters() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put(SCRAPER_ID, scraperId);
            params.put(SINCE, since);
            return params;
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class SyncSince extends IndexJobSpec {
        private final String since;

        public SyncSince(String since) {
            super(JobType.SYNC_SINCE);
            this.since = since;
        }

        @Override
        public Map<String, Object> toParameters() {
            return Map.of(SINCE, since);
        }
    }

    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class FullReindex extends IndexJobSpec {

        public FullReindex() {
            super(JobType.INDEX_BULK);
        }

        @Override
        public Map<String, Object> toParameters() {
            return Map.of();
        }
    }
}
