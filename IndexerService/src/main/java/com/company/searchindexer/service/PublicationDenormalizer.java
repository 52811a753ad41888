package com.company.searchindexer.service;

import com.company.searchindexer.model.IndexDocument;
import com.company.searchindexer.model.PublicationRow;
import com.company.searchindexer.repository.PublicationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Aplana una publicación y todas sus relaciones (tags, país, mercados, tipo de licitación, divisa)
 * en un único documento para Elasticsearch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublicationDenormalizer {

    private static final List<String> PLAIN_FIELDS = List.of(
            "id", "scraper", "idexterno", "referencia", "objeto", "agencia", "oficina", "link",
            "pais", "rubro", "subrubro", "tipo", "tipo_id", "tipo_cliente_id", "contacto",
            "observaciones", "categoria", "attachs", "divisaSimboloISO");

    private static final List<String> DATE_FIELDS = List.of(
            "publicado", "actualizado", "apertura", "cierre", "cargado", "editado");

    private final PublicationRepository publicationRepository;

    /**
     * @return el documento, o vacío si la publicación no existe
     * @throws com.company.searchindexer.exception.SourceUnavailableException si MySQL no responde
     */
    public Optional<IndexDocument> denormalize(long publicationId) {
        Optional<PublicationRow> row = publicationRepository.fetchWithJoins(publicationId);
        if (row.isEmpty()) {
            log.warn("Publication {} not found", publicationId);
            return Optional.empty();
        }
        return Optional.of(toDocument(row.get()));
    }

    IndexDocument toDocument(PublicationRow pub) {
        IndexDocument.Builder doc = IndexDocument.builder();

        for (String field : PLAIN_FIELDS) {
            doc.put(field, pub.get(field));
        }
        for (String field : DATE_FIELDS) {
            doc.put(field, SourceValues.sanitizeDate(pub.get(field)));
        }
        doc.put("visible", SourceValues.toBoolean(pub.get("visible")));
        doc.put("monto", AmountParser.parse(pub.get("monto")).orElse(null));

        doc.putArray("tag_ids", SourceValues.splitIds(pub.getString("tag_ids_raw")));
        doc.putArray("tags", SourceValues.splitTags(pub.getString("tags_raw")));
        doc.put("pais_nombre", pub.get("pais_nombre"));
        doc.put("pais_id", pub.get("pais_id"));
        doc.putArray("mercado_ids", SourceValues.splitIds(pub.getString("mercado_ids_raw")));
        doc.putObject("tipo_licit_ids", IndexDocument.builder()
                .put("esAR", pub.get("tipo_licit_id_esAR"))
                .put("ptBR", pub.get("tipo_licit_id_ptBR"))
                .put("enUS", pub.get("tipo_licit_id_enUS"))
                .build());
        doc.put("tasaCambioUSD", SourceValues.toDouble(pub.get("tasaCambioUSD"), 0d));
        doc.put("vigente", Boolean.TRUE.equals(SourceValues.toBoolean(pub.get("vigente"))));

        return doc.build();
    }
}
