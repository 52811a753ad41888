package com.company.searchindexer.service;

import com.company.searchindexer.model.CompiledQuery;
import common.indexer.dto.SearchRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Traduce los parámetros de búsqueda del frontal PHP a una consulta bool de Elasticsearch.
 */
@Slf4j
@Component
public class PublicationQueryCompiler {

    static final List<String> FREE_TEXT_FIELDS = List.of("objeto", "agencia", "oficina", "referencia");

    private static final DateTimeFormatter FORM_DATE = DateTimeFormatter.ofPattern("dd/MM/uuuu")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter INDEX_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final String START_OF_DAY = " 00:00:00";
    private static final String END_OF_DAY = " 23:59:59";

    public CompiledQuery compile(SearchRequest params) {
        CompiledQuery.Builder query = CompiledQuery.builder();
        if (params == null) {
            return query.build();
        }

        if (hasText(params.getSearch())) {
            String term = params.getSearch().trim();
            for (String field : FREE_TEXT_FIELDS) {
                query.should(CompiledQuery.wildcardContains(field, term));
            }
        }

        if (hasText(params.getObjeto())) {
            query.must(CompiledQuery.wildcardContains("objeto", params.getObjeto().trim()));
        }
        if (hasText(params.getAgencia())) {
            query.must(CompiledQuery.wildcardContains("agencia", params.getAgencia().trim()));
        }

        String pais = params.getPais();
        if (isActiveFilter(pais)) {
            Long paisId = parseInteger(pais);
            if (paisId != null) {
                query.filter(CompiledQuery.term("pais_id", paisId));
            } else {
                query.filter(CompiledQuery.term("pais_nombre", pais));
            }
        }

        // Un rubro no numérico no filtra
        String rubro = params.getRubro();
        if (isActiveFilter(rubro)) {
            Long tagId = parseInteger(rubro);
            if (tagId != null) {
                query.filter(CompiledQuery.term("tag_ids", tagId));
            }
        }

        if (SearchRequest.FILTER_MODE_USER_TAGS.equals(params.getFilterMode()) && params.getUserTagIds() != null) {
            List<Integer> tagIds = params.getUserTagIds().stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            if (!tagIds.isEmpty()) {
                query.filter(CompiledQuery.terms("tag_ids", tagIds));
            }
        }

        Map<String, Object> aperturaRange = new LinkedHashMap<>();
        if (hasText(params.getAperturaFrom())) {
            aperturaRange.put("gte", toBoundary(params.getAperturaFrom().trim(), START_OF_DAY));
        }
        if (hasText(params.getAperturaTo())) {
            aperturaRange.put("lte", toBoundary(params.getAperturaTo().trim(), END_OF_DAY));
        }
        if (!aperturaRange.isEmpty()) {
            query.filter(CompiledQuery.range("apertura", aperturaRange));
        }

        if ("0".equals(params.getIncluirVencidos()) || "1".equals(params.getSoloVigentes())) {
            query.filter(CompiledQuery.term("vigente", true));
        }

        return query.build();
    }

    /**
     * dd/MM/yyyy pasa a límite de día completo. Cualquier otro formato se pasa tal cual para los
     * clientes antiguos que ya envían yyyy-MM-dd; si no trae hora se le añade la del límite.
     */
    String toBoundary(String value, String timeOfDay) {
        try {
            return LocalDate.parse(value, FORM_DATE).format(INDEX_DATE) + timeOfDay;
        } catch (DateTimeParseException e) {
            log.debug("Date '{}' is not dd/MM/yyyy, passing it through", value);
            return value.contains(":") ? value : value + timeOfDay;
        }
    }

    private static boolean isActiveFilter(String value) {
        return hasText(value) && !SearchRequest.IGNORE_FILTER.equals(value.trim());
    }

    private static Long parseInteger(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
