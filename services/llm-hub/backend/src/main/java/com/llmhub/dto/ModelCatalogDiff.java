package com.llmhub.dto;

import java.util.Set;

/**
 * 폴링 1회의 레지스트리 변경분
 */
public record ModelCatalogDiff(Set<String> added, Set<String> removed) {

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
