package common.indexer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Petición para arrancar un proceso de indexación.
 * Los parámetros varían según el tipo, ver {@link JobType}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartIndexerRequest {

    private String type;

    private Map<String, Object> params = new HashMap<>();
}
