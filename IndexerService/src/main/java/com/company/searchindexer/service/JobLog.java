package com.company.searchindexer.service;

import org.slf4j.Logger;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

/**
 * Log de un proceso concreto. Cada línea va al logger de la aplicación y al buffer del proceso,
 * de donde la recoge el panel.
 */
public class JobLog {

    private final Long jobId;
    private final JobLogAggregator aggregator;
    private final Logger delegate;

    JobLog(Long jobId, JobLogAggregator aggregator, Logger delegate) {
        this.jobId = jobId;
        this.aggregator = aggregator;
        this.delegate = delegate;
    }

    public void info(String format, Object... args) {
        FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
        delegate.info("[job {}] {}", jobId, tuple.getMessage());
        aggregator.append(jobId, "INFO", tuple.getMessage());
    }

    public void warn(String format, Object... args) {
        FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
        delegate.warn("[job {}] {}", jobId, tuple.getMessage());
        aggregator.append(jobId, "WARNING", tuple.getMessage());
    }

    public void error(String format, Object... args) {
        FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
        if (tuple.getThrowable() != null) {
            delegate.error("[job {}] {}", jobId, tuple.getMessage(), tuple.getThrowable());
        } else {
            delegate.error("[job {}] {}", jobId, tuple.getMessage());
        }
        aggregator.append(jobId, "ERROR", tuple.getMessage());
    }
}
