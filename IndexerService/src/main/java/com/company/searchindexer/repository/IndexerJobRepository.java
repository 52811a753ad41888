package com.company.searchindexer.repository;

import com.company.searchindexer.model.IndexerJob;
import common.indexer.dto.JobStatusEnum;
import common.indexer.dto.JobType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface IndexerJobRepository extends JpaRepository<IndexerJob, Long> {

    /**
     * Transición a estado terminal. Solo afecta a procesos que siguen en RUNNING,
     * así un proceso terminado nunca cambia de estado.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE IndexerJob j
               SET j.status = :status,
                   j.completedAt = :completedAt,
                   j.errorMessage = :errorMessage
             WHERE j.id = :id
               AND j.status = common.indexer.dto.JobStatusEnum.RUNNING
            """)
    int finishIfRunning(@Param("id") Long id,
                        @Param("status") JobStatusEnum status,
                        @Param("completedAt") LocalDateTime completedAt,
                        @Param("errorMessage") String errorMessage);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE IndexerJob j
               SET j.progress.current = :current,
                   j.progress.total = :total,
                   j.progress.indexed = :indexed,
                   j.progress.failed = :failed,
                   j.progress.message = :message
             WHERE j.id = :id
            """)
    int updateProgress(@Param("id") Long id,
                       @Param("current") Integer current,
                       @Param("total") Integer total,
                       @Param("indexed") Integer indexed,
                       @Param("failed") Integer failed,
                       @Param("message") String message);

    @Query("""
            SELECT j FROM IndexerJob j
             WHERE (:status IS NULL OR j.status = :status)
               AND (:type IS NULL OR j.type = :type)
               AND (:ownerId IS NULL OR j.ownerId = :ownerId)
             ORDER BY j.startedAt DESC, j.id DESC
            """)
    List<IndexerJob> search(@Param("status") JobStatusEnum status,
                            @Param("type") JobType type,
                            @Param("ownerId") Long ownerId,
                            Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            DELETE FROM IndexerJob j
             WHERE j.status IN :statuses
               AND ((j.completedAt IS NOT NULL AND j.completedAt < :cutoff)
                 OR (j.completedAt IS NULL AND j.startedAt < :cutoff))
            """)
    int deleteFinishedBefore(@Param("statuses") Collection<JobStatusEnum> statuses,
                             @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT j.id FROM IndexerJob j")
    List<Long> findAllIds();
}
