package com.company.searchindexer.exception;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(Long jobId) {
        super("Process " + jobId + " not found");
    }
}
