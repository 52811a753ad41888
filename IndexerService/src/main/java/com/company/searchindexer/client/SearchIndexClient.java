package com.company.searchindexer.client;

import com.company.searchindexer.model.CompiledQuery;
import com.company.searchindexer.model.IndexDocument;

import java.util.List;
import java.util.Map;

/**
 * Índice de búsqueda de publicaciones.
 */
public interface SearchIndexClient {

    /**
     * @return false si el motor no responde; nunca lanza excepción
     */
    boolean ping();

    /**
     * Crea el índice con la definición dada (settings y mappings) si todavía no existe.
     *
     * @return true si el índice se ha creado en esta llamada
     */
    boolean ensureIndex(Map<String, Object> definition);

    void upsert(Object id, IndexDocument document);

    /**
     * Escribe todos los documentos en una sola petición y devuelve el resultado de cada uno.
     */
    BulkResult bulkUpsert(List<IndexDocument> documents);

    SearchHits search(CompiledQuery query, int from, int size, List<Map<String, Object>> sort);
}
