package com.company.searchindexer.repository;

import com.company.searchindexer.model.PublicationRow;

import java.util.List;
import java.util.Optional;

/**
 * Acceso de solo lectura a las publicaciones en MySQL.
 * Cualquier fallo de lectura se traduce a {@link com.company.searchindexer.exception.SourceUnavailableException}.
 */
public interface PublicationRepository {

    Optional<PublicationRow> fetchWithJoins(long publicationId);

    /**
     * Publicaciones visibles cargadas o editadas desde {@code since}, las más recientes primero.
     *
     * @param scraperId si no es null, limita a las publicaciones de ese scraper
     */
    List<Long> listChangedSince(String since, Long scraperId, int limit);

    List<Long> listAllIds(int pageSize, int offset);
}
