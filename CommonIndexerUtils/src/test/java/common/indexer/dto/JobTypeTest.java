package common.indexer.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTypeTest {

    @Test
    void resolvesByTagOrName() {
        assertThat(JobType.fromTag("index-licitacion")).isEqualTo(JobType.INDEX_PUBLICATION);
        assertThat(JobType.fromTag("SYNC_SINCE")).isEqualTo(JobType.SYNC_SINCE);
    }

    @Test
    void unknownTagListsValidOnes() {
        assertThatThrownBy(() -> JobType.fromTag("reindex-everything"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index-bulk")
                .hasMessageContaining("index-scraper-publications");
    }

    @Test
    void serializesAsTag() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(mapper.writeValueAsString(JobType.INDEX_BULK)).isEqualTo("\"index-bulk\"");
        assertThat(mapper.readValue("\"sync-since\"", JobType.class)).isEqualTo(JobType.SYNC_SINCE);
    }

    @Test
    void onlyRunningCanFinish() {
        assertThat(JobStatusEnum.RUNNING.canTransitionTo(JobStatusEnum.STOPPED)).isTrue();
        assertThat(JobStatusEnum.RUNNING.canTransitionTo(JobStatusEnum.RUNNING)).isFalse();
        assertThat(JobStatusEnum.COMPLETED.canTransitionTo(JobStatusEnum.FAILED)).isFalse();
        assertThat(JobStatusEnum.STOPPED.isTerminal()).isTrue();
    }
}
