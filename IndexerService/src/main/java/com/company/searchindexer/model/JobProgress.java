package com.company.searchindexer.model;

import common.indexer.dto.ProgressSnapshot;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobProgress {

    @Column(name = "progress_current")
    private Integer current;

    @Column(name = "progress_total")
    private Integer total;

    @Column(name = "progress_indexed")
    private Integer indexed;

    @Column(name = "progress_failed")
    private Integer failed;

    @Column(name = "progress_message", length = 500)
    private String message;

    public static JobProgress from(ProgressSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        return new JobProgress(snapshot.getCurrent(), snapshot.getTotal(), snapshot.getIndexed(),
                snapshot.getFailed(), snapshot.getMessage());
    }

    public ProgressSnapshot toSnapshot() {
        return new ProgressSnapshot(current, total, indexed, failed, message);
    }
}
