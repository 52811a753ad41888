package common.indexer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Respuesta de búsqueda con el mismo formato que devolvía la consulta MySQL original.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private List<Map<String, Object>> publicaciones;
    private long total;
    private int pagina;
    private int paginas;
}
