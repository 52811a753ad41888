package com.company.searchindexer.repository;

import com.company.searchindexer.exception.SourceUnavailableException;
import com.company.searchindexer.model.PublicationRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@Slf4j
public class JdbcPublicationRepository implements PublicationRepository {

    private static final String FETCH_WITH_JOINS_SQL = """
            SELECT
                p.*,
                GROUP_CONCAT(DISTINCT tp.tag) AS tag_ids_raw,
                GROUP_CONCAT(DISTINCT CONCAT(t.id, ':', COALESCE(t.descripcion, ''))) AS tags_raw,
                pa.nombre AS pais_nombre,
                pa.id AS pais_id,
                GROUP_CONCAT(DISTINCT sm.mercado_id) AS mercado_ids_raw,
                ptl.tipo_licit_id_esAR,
                ptl.tipo_licit_id_ptBR,
                ptl.tipo_licit_id_enUS,
                d.tasaCambioUSD,
                (CASE WHEN p.apertura >= UTC_TIMESTAMP() THEN 1 ELSE 0 END) AS vigente
            FROM publicaciones p
            LEFT JOIN tags_publicaciones tp ON p.id = tp.publicacion
            LEFT JOIN tags t ON tp.tag = t.id AND t.usuario IS NULL
            LEFT JOIN paises pa ON (
                CASE
                    WHEN p.pais REGEXP '^[0-9]+$' THEN pa.id = CAST(p.pais AS UNSIGNED)
                    ELSE pa.nombre = p.pais
                END
            )
            LEFT JOIN scrapers_mercados sm ON p.scraper = sm.scraper_id
            LEFT JOIN publicaciones_tipos_licit ptl ON p.tipo_id = ptl.id
            LEFT JOIN divisas d ON p.divisaSimboloISO = d.SimboloISO
            WHERE p.id = ?
            GROUP BY p.id
            """;

    private static final String CHANGED_SINCE_SQL = """
            SELECT id FROM publicaciones
            WHERE (cargado >= ? OR editado >= ?)
            AND visible = 1
            ORDER BY editado DESC, id DESC
            LIMIT ?
            """;

    private static final String CHANGED_SINCE_BY_SCRAPER_SQL = """
            SELECT id FROM publicaciones
            WHERE scraper = ?
            AND (cargado >= ? OR editado >= ?)
            AND visible = 1
            ORDER BY editado DESC, id DESC
            LIMIT ?
            """;

    private static final String ALL_IDS_SQL = """
            SELECT id FROM publicaciones
            WHERE visible = 1
            ORDER BY id ASC
            LIMIT ? OFFSET ?
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcPublicationRepository(@Qualifier("publicationJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<PublicationRow> fetchWithJoins(long publicationId) {
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(FETCH_WITH_JOINS_SQL, publicationId);
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new PublicationRow(rows.get(0)));
        } catch (DataAccessException e) {
            throw new SourceUnavailableException("Failed to read publication " + publicationId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Long> listChangedSince(String since, Long scraperId, int limit) {
        try {
            if (scraperId != null) {
                return jdbcTemplate.queryForList(CHANGED_SINCE_BY_SCRAPER_SQL, Long.class, scraperId, since, since, limit);
            }
            return jdbcTemplate.queryForList(CHANGED_SINCE_SQL, Long.class, since, since, limit);
        } catch (DataAccessException e) {
            log.error("Failed to get publications changed since {} (scraper {}): {}", since, scraperId, e.getMessage());
            throw new SourceUnavailableException("Failed to list publications changed since " + since, e);
        }
    }

    @Override
    public List<Long> listAllIds(int pageSize, int offset) {
        try {
            return jdbcTemplate.queryForList(ALL_IDS_SQL, Long.class, pageSize, offset);
        } catch (DataAccessException e) {
            log.error("Failed to get publication IDs batch at offset {}: {}", offset, e.getMessage());
            throw new SourceUnavailableException("Failed to list publication ids at offset " + offset, e);
        }
    }
}
