package com.company.searchindexer.client;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
public class SearchHits {

    private long total;
    private List<Map<String, Object>> sources;
}
