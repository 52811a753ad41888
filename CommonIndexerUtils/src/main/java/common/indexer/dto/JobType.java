package common.indexer.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tipos de proceso de indexación. El tag es el valor que viaja en la API y se guarda en base de datos.
 */
public enum JobType {
    INDEX_PUBLICATION("index-licitacion"),
    INDEX_SCRAPER_PUBLICATIONS("index-scraper-publications"),
    SYNC_SINCE("sync-since"),
    INDEX_BULK("index-bulk");

    private final String tag;

    JobType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static JobType fromTag(String tag) {
        for (JobType type : values()) {
            if (type.tag.equals(tag) || type.name().equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid indexer type '" + tag + "'. Must be one of: " + validTags());
    }

    public static List<String> validTags() {
        return Arrays.stream(values()).map(JobType::getTag).collect(Collectors.toList());
    }
}
