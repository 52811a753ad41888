package com.company.searchindexer.job;

import com.company.searchindexer.client.BulkResult;
import com.company.searchindexer.client.SearchIndexClient;
import com.company.searchindexer.config.IndexerProperties;
import com.company.searchindexer.exception.PublicationNotFoundException;
import com.company.searchindexer.model.IndexDocument;
import com.company.searchindexer.repository.PublicationRepository;
import com.company.searchindexer.service.JobLog;
import com.company.searchindexer.service.JobLogAggregator;
import com.company.searchindexer.service.JobRegistry;
import com.company.searchindexer.service.PublicationDenormalizer;
import common.indexer.dto.ProgressSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recetas de indexación. Cada una se ejecuta en un worker, de forma secuencial, y termina
 * dejando el proceso en un estado terminal. La parada se comprueba entre elemento y elemento
 * (o entre páginas en la reindexación completa).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexingExecutor {

    private static final String COMPLETED = "Completed";
    private static final String STOPPED = "Stopped";

    private final PublicationDenormalizer denormalizer;
    private final PublicationRepository publicationRepository;
    private final SearchIndexClient searchIndexClient;
    private final JobRegistry jobRegistry;
    private final JobLogAggregator logAggregator;
    private final IndexerProperties properties;

    public void execute(Long jobId, IndexJobSpec spec, CancellationToken token) {
        JobLog jobLog = logAggregator.open(jobId, log);
        jobLog.info("🚀 Process {} started: {} {}", jobId, spec.getType().getTag(), spec.toParameters());
        try {
            switch (spec.getType()) {
                case INDEX_PUBLICATION:
                    indexPublication(jobId, (IndexJobSpec.SinglePublication) spec, token, jobLog);
                    break;
                case INDEX_SCRAPER_PUBLICATIONS:
                    IndexJobSpec.ScraperSince scraper = (IndexJobSpec.ScraperSince) spec;
                    indexChangedSince(jobId, scraper.getSince(), scraper.getScraperId(),
                            properties.getBatch().getScraperLimit(),
                            properties.getBatch().getScraperProgressEvery(), token, jobLog);
                    break;
                case SYNC_SINCE:
                    indexChangedSince(jobId, ((IndexJobSpec.SyncSince) spec).getSince(), null,
                            properties.getBatch().getSyncSinceLimit(),
                            properties.getBatch().getSyncSinceProgressEvery(), token, jobLog);
                    break;
                case INDEX_BULK:
                    reindexAll(jobId, token, jobLog);
                    break;
                default:
                    jobRegistry.fail(jobId, "Unsupported indexer type: " + spec.getType().getTag());
            }
        } catch (PublicationNotFoundException e) {
            jobLog.warn(e.getMessage());
            jobRegistry.updateProgress(jobId, ProgressSnapshot.of(e.getMessage(), 1, 2, 0, 0));
            jobRegistry.fail(jobId, e.getMessage());
        } catch (Exception e) {
            String error = "Process failed: " + e.getMessage();
            jobLog.error("❌ {}", error, e);
            jobRegistry.fail(jobId, error);
        }
    }

    void indexPublication(Long jobId, IndexJobSpec.SinglePublication spec, CancellationToken token, JobLog jobLog) {
        long publicationId = spec.getPublicationId();
        progress(jobId, jobLog, ProgressSnapshot.of("Starting index...", 0, 1));

        if (!searchEngineAvailable(jobId, jobLog, "Elasticsearch not available for publication " + publicationId)) {
            return;
        }
        if (stopRequested(jobId, token, jobLog, ProgressSnapshot.of(STOPPED, 0, 1, 0, 0))) {
            return;
        }

        progress(jobId, jobLog, ProgressSnapshot.of("Denormalizing publication...", 1, 2));
        IndexDocument document = denormalizer.denormalize(publicationId)
                .orElseThrow(() -> new PublicationNotFoundException(publicationId));
        if (stopRequested(jobId, token, jobLog, ProgressSnapshot.of(STOPPED, 1, 2, 0, 0))) {
            return;
        }

        progress(jobId, jobLog, ProgressSnapshot.of("Indexing to Elasticsearch...", 2, 2));
        searchIndexClient.upsert(publicationId, document);
        jobLog.info("✅ Successfully indexed publication {}", publicationId);

        jobRegistry.updateProgress(jobId, ProgressSnapshot.of(COMPLETED, 2, 2, 1, 0));
        jobRegistry.complete(jobId);
    }

    void indexChangedSince(Long jobId, String since, Long scraperId, int limit, int progressEvery,
                           CancellationToken token, JobLog jobLog) {
        progress(jobId, jobLog, ProgressSnapshot.of("Starting indexing...", 0, 0));

        if (!searchEngineAvailable(jobId, jobLog, "Elasticsearch not available - skipping indexing")) {
            return;
        }
        if (stopRequested(jobId, token, jobLog, ProgressSnapshot.of(STOPPED, 0, 0, 0, 0))) {
            return;
        }

        progress(jobId, jobLog, ProgressSnapshot.of("Fetching publications...", 0, 0));
        List<Long> ids = publicationRepository.listChangedSince(since, scraperId, limit);
        int total = ids.size();
        if (scraperId != null) {
            jobLog.info("Found {} publications for scraper {} since {}", total, scraperId, since);
        } else {
            jobLog.info("Found {} publications changed since {}", total, since);
        }
        jobRegistry.updateProgress(jobId, ProgressSnapshot.of("Found " + total + " publications to index", 0, total));

        int indexed = 0;
        int failed = 0;
        for (int i = 0; i < total; i++) {
            if (stopRequested(jobId, token, jobLog, ProgressSnapshot.of(STOPPED, i, total, indexed, failed))) {
                return;
            }
            Long publicationId = ids.get(i);
            try {
                Optional<IndexDocument> document = denormalizer.denormalize(publicationId);
                if (document.isPresent()) {
                    searchIndexClient.upsert(publicationId, document.get());
                    indexed++;
                }
            } catch (Exception e) {
                failed++;
                jobLog.error("Failed to index publication {}: {}", publicationId, e.getMessage());
            }

            int processed = i + 1;
            if (processed % progressEvery == 0) {
                jobRegistry.updateProgress(jobId, ProgressSnapshot.of(
                        "Indexing... " + processed + "/" + total, processed, total, indexed, failed));
                jobLog.info("Progress: {}/{} ({} indexed, {} failed)", processed, total, indexed, failed);
            }
        }

        jobLog.info("✅ Indexing completed: {} indexed, {} failed out of {}", indexed, failed, total);
        jobRegistry.updateProgress(jobId, ProgressSnapshot.of(COMPLETED, total, total, indexed, failed));
        jobRegistry.complete(jobId);
    }

    void reindexAll(Long jobId, CancellationToken token, JobLog jobLog) {
        int pageSize = properties.getBatch().getBulkPageSize();
        progress(jobId, jobLog, ProgressSnapshot.of("Starting bulk indexing...", 0, 0));

        if (!searchEngineAvailable(jobId, jobLog, "Elasticsearch not available - skipping bulk indexing")) {
            return;
        }
        if (stopRequested(jobId, token, jobLog, ProgressSnapshot.of(STOPPED, 0, 0, 0, 0))) {
            return;
        }

        // Primera pasada: solo contar
        progress(jobId, jobLog, ProgressSnapshot.of("Counting publications...", 0, 0));
        int total = 0;
        int offset = 0;
        while (true) {
            if (stopRequested(jobId, token, jobLog, ProgressSnapshot.of(STOPPED, 0, total, 0, 0))) {
                return;
            }
            int size = publicationRepository.listAllIds(pageSize, offset).size();
            total += size;
            if (size < pageSize) {
                break;
            }
            offset += pageSize;
        }
        jobLog.info("Found {} publications to index", total);
        jobRegistry.updateProgress(jobId, ProgressSnapshot.of("Found " + total + " publications to index", 0, total));

        int processed = 0;
        int indexed = 0;
        int failed = 0;
        offset = 0;
        while (true) {
            if (stopRequested(jobId, token, jobLog, ProgressSnapshot.of(STOPPED, processed, total, indexed, failed))) {
                return;
            }
            List<Long> page = publicationRepository.listAllIds(pageSize, offset);
            if (page.isEmpty()) {
                break;
            }

            List<IndexDocument> documents = new ArrayList<>(page.size());
            for (Long publicationId : page) {
                try {
                    denormalizer.denormalize(publicationId).ifPresent(documents::add);
                } catch (Exception e) {
                    failed++;
                    jobLog.error("Failed to denormalize publication {}: {}", publicationId, e.getMessage());
                }
            }

            if (!documents.isEmpty()) {
                try {
                    BulkResult result = searchIndexClient.bulkUpsert(documents);
                    indexed += result.getSucceeded();
                    failed += result.getFailed();
                    if (result.getFailed() > 0) {
                        jobLog.warn("Bulk page at offset {}: {} documents rejected, first: {}", offset,
                                result.getFailed(), result.getFailures().isEmpty() ? "-" : result.getFailures().get(0));
                    }
                } catch (Exception e) {
                    failed += documents.size();
                    jobLog.error("Bulk insert failed at offset {}: {}", offset, e.getMessage());
                }
            }

            processed += page.size();
            jobRegistry.updateProgress(jobId, ProgressSnapshot.of(
                    "Bulk indexing... " + processed + "/" + total, processed, total, indexed, failed));
            jobLog.info("Bulk indexing progress: {}/{} processed, {} indexed", processed, total, indexed);

            if (page.size() < pageSize) {
                break;
            }
            offset += pageSize;
        }

        jobLog.info("✅ Bulk indexing completed: {} indexed, {} failed out of {}", indexed, failed, total);
        jobRegistry.updateProgress(jobId, ProgressSnapshot.of(COMPLETED, total, total, indexed, failed));
        jobRegistry.complete(jobId);
    }

    private boolean searchEngineAvailable(Long jobId, JobLog jobLog, String error) {
        if (searchIndexClient.ping()) {
            return true;
        }
        jobLog.warn("⚠️ {}", error);
        jobRegistry.fail(jobId, error);
        return false;
    }

    private boolean stopRequested(Long jobId, CancellationToken token, JobLog jobLog, ProgressSnapshot last) {
        if (!token.isCancellationRequested()) {
            return false;
        }
        jobLog.info("Process was stopped");
        jobRegistry.updateProgress(jobId, last);
        jobRegistry.markStopped(jobId);
        return true;
    }

    private void progress(Long jobId, JobLog jobLog, ProgressSnapshot snapshot) {
        jobRegistry.updateProgress(jobId, snapshot);
        jobLog.info(snapshot.getMessage());
    }
}
