package com.company.searchindexer.model;

import common.indexer.dto.JobStatusEnum;
import common.indexer.dto.JobType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "indexer_jobs", indexes = {
        @Index(name = "idx_indexer_jobs_status", columnList = "status"),
        @Index(name = "idx_indexer_jobs_started_at", columnList = "started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexerJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private JobType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatusEnum status;

    @Column(name = "parameters_json", columnDefinition = "TEXT")
    private String parametersJson;

    @Column(name = "owner_id")
    private Long ownerId;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    // Solo se informa al pasar a un estado terminal
    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Embedded
    private JobProgress progress;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @PrePersist
    public void prePersist() {
        if (status == null) {
            status = JobStatusEnum.RUNNING;
        }
        if (startedAt == null) {
            startedAt = LocalDateTime.now();
        }
    }
}
