package com.company.searchindexer.job;

import com.company.searchindexer.exception.InvalidJobParametersException;
import common.indexer.dto.JobType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexJobSpecTest {

    @Test
    void singlePublicationAcceptsNumberOrString() {
        assertThat(IndexJobSpec.from(JobType.INDEX_PUBLICATION, Map.of("publicacion_id", 42)))
                .isEqualTo(new IndexJobSpec.SinglePublication(42L));
        assertThat(IndexJobSpec.from(JobType.INDEX_PUBLICATION, Map.of("publicacion_id", "42")))
                .isEqualTo(new IndexJobSpec.SinglePublication(42L));
    }

    @Test
    void scraperNeedsBothParams() {
        assertThatThrownBy(() -> IndexJobSpec.from(JobType.INDEX_SCRAPER_PUBLICATIONS, Map.of("scraper_id", 3)))
                .isInstanceOf(InvalidJobParametersException.class)
                .hasMessageContaining("since");

        IndexJobSpec spec = IndexJobSpec.from(JobType.INDEX_SCRAPER_PUBLICATIONS,
                Map.of("scraper_id", 3, "since", "2024-05-01 08:30:00"));
        assertThat(spec.toParameters()).containsEntry("scraper_id", 3L).containsEntry("since", "2024-05-01 08:30:00");
    }

    @Test
    void sinceWithoutTimeStartsAtMidnight() {
        IndexJobSpec spec = IndexJobSpec.from(JobType.SYNC_SINCE, Map.of("since", "2024-05-01"));

        assertThat(((IndexJobSpec.SyncSince) spec).getSince()).isEqualTo("2024-05-01 00:00:00");
    }

    @Test
    void rejectsBadValues() {
        assertThatThrownBy(() -> IndexJobSpec.from(JobType.SYNC_SINCE, Map.of("since", "ayer")))
                .isInstanceOf(InvalidJobParametersException.class);
        assertThatThrownBy(() -> IndexJobSpec.from(JobType.INDEX_PUBLICATION, Map.of("publicacion_id", "x")))
                .isInstanceOf(InvalidJobParametersException.class);
        assertThatThrownBy(() -> IndexJobSpec.from(JobType.INDEX_PUBLICATION, null))
                .isInstanceOf(InvalidJobParametersException.class)
                .hasMessageContaining("publicacion_id");
    }

    @Test
    void bulkTakesNoParams() {
        assertThat(IndexJobSpec.from(JobType.INDEX_BULK, Map.of("ignored", 1)).toParameters()).isEmpty();
    }
}
