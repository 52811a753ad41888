package com.company.searchindexer.service;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
public class ReaperReport {

    private LocalDateTime cutoff;
    private int deletedJobs;
    private int removedLogBuffers;
}
