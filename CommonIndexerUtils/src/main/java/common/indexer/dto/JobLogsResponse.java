package common.indexer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobLogsResponse {

    private List<LogRecord> logs;

    @JsonProperty("last_timestamp")
    private String lastTimestamp;

    @JsonProperty("has_more")
    private boolean hasMore;
}
