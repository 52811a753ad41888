package com.company.searchindexer.client;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Resultado por documento de una escritura bulk.
 */
@Data
@AllArgsConstructor
public class BulkResult {

    private int succeeded;
    private int failed;
    private List<ItemFailure> failures;

    public static BulkResult allFailed(int count, String reason) {
        return new BulkResult(0, count, List.of(new ItemFailure(null, reason)));
    }

    @Data
    @AllArgsConstructor
    public static class ItemFailure {
        private String id;
        private String reason;
    }
}
