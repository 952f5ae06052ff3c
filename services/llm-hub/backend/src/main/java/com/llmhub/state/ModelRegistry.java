package com.llmhub.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.llmhub.dto.ModelCatalogDiff;
import com.llmhub.dto.ModelRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 디스커버리 소유 모델 레지스트리
 *
 * - writer 는 디스커버리 루프 하나뿐 (apply)
 * - reader 는 volatile 로 게시된 불변 스냅샷만 본다
 */
public class ModelRegistry {

    private volatile Map<String, ModelRecord> models = Map.of();

    /**
     * 현재 카탈로그로 레지스트리를 정확히 교체하고 변경분을 반환
     * - 새로 보인 id: 추가 (발견 시각 = now)
     * - 이미 있던 id: 메타데이터만 갱신, 최초 발견 시각 유지
     * - 사라진 id: 제거
     */
    public ModelCatalogDiff apply(Map<String, JsonNode> catalog, Instant now) {
        Map<String, ModelRecord> previous = models;
        Map<String, ModelRecord> next = new LinkedHashMap<>();
        Set<String> added = new LinkedHashSet<>();

        catalog.forEach((id, metadata) -> {
            ModelRecord existing = previous.get(id);
            if (existing == null) {
                added.add(id);
                next.put(id, new ModelRecord(id, metadata, now));
            } else {
                next.put(id, existing.withMetadata(metadata));
            }
        });

        Set<String> removed = new LinkedHashSet<>();
        for (String id : previous.keySet()) {
            if (!catalog.containsKey(id)) {
                removed.add(id);
            }
        }

        models = Map.copyOf(next);
        return new ModelCatalogDiff(Set.copyOf(added), Set.copyOf(removed));
    }

    public List<ModelRecord> getModels() {
        return snapshot().stream()
                .sorted(Comparator.comparing(ModelRecord::id))
                .toList();
    }

    public Optional<ModelRecord> getModel(String id) {
        return Optional.ofNullable(models.get(id));
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }

    public int size() {
        return models.size();
    }

    public Set<String> ids() {
        return models.keySet();
    }

    private Collection<ModelRecord> snapshot() {
        return models.values();
    }
}
