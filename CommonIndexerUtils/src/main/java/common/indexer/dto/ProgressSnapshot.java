package common.indexer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Foto del progreso de un proceso. Se sobrescribe completa en cada actualización.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressSnapshot {

    private Integer current;
    private Integer total;
    private Integer indexed;
    private Integer failed;
    private String message;

    public static ProgressSnapshot of(String message, int current, int total) {
        return ProgressSnapshot.builder()
                .message(message)
                .current(current)
                .total(total)
                .build();
    }

    public static ProgressSnapshot of(String message, int current, int total, int indexed, int failed) {
        return new ProgressSnapshot(current, total, indexed, failed, message);
    }
}
