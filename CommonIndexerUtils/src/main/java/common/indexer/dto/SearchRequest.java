package common.indexer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parámetros de búsqueda de publicaciones. Mismo formato que envía el frontal PHP.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    public static final String IGNORE_FILTER = "all";
    public static final String FILTER_MODE_USER_TAGS = "user_tags";

    @Builder.Default
    private Integer page = 1;

    @JsonProperty("page_size")
    @Builder.Default
    private Integer pageSize = 15;

    // '0' = solo vigentes, '1' = todas
    private String incluirVencidos;

    // '1' = solo vigentes
    private String soloVigentes;

    private String objeto;
    private String agencia;

    // id o nombre del país, 'all' para ignorar
    private String pais;

    // id de tag, 'all' para ignorar
    private String rubro;

    // dd/MM/yyyy
    @JsonProperty("apertura_fr")
    private String aperturaFrom;

    @JsonProperty("apertura_to")
    private String aperturaTo;

    private String search;

    @JsonProperty("user_tag_ids")
    private List<Integer> userTagIds;

    @JsonProperty("filter_mode")
    @Builder.Default
    private String filterMode = IGNORE_FILTER;
}
