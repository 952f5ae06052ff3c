package com.llmhub.state;

import com.llmhub.dto.RegistryStatus;
import com.llmhub.dto.ServiceRegistryEntry;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 게이트웨이 서비스 레지스트리
 *
 * - writer 는 레지스트리 폴러 하나뿐 (upsert / remove)
 * - 라우터는 불변 스냅샷만 읽는다
 */
public class ServiceRegistry {

    private volatile Map<String, ServiceRegistryEntry> entries = Map.of();
    private volatile Instant lastDiscoveryAt;

    public void upsert(ServiceRegistryEntry entry) {
        Map<String, ServiceRegistryEntry> next = new HashMap<>(entries);
        next.put(entry.serviceName(), entry);
        entries = Map.copyOf(next);
        lastDiscoveryAt = entry.lastSeen();
    }

    /**
     * @return 실제로 제거된 항목이 있었는지
     */
    public boolean remove(String serviceName) {
        Map<String, ServiceRegistryEntry> current = entries;
        if (!current.containsKey(serviceName)) {
            return false;
        }
        Map<String, ServiceRegistryEntry> next = new HashMap<>(current);
        next.remove(serviceName);
        entries = Map.copyOf(next);
        return true;
    }

    public Optional<ServiceRegistryEntry> get(String serviceName) {
        return Optional.ofNullable(entries.get(serviceName));
    }

    /**
     * 도구를 가진 healthy 항목, 서비스 이름 순
     */
    public List<ServiceRegistryEntry> healthyEntriesFor(String toolName) {
        return entries.values().stream()
                .filter(ServiceRegistryEntry::healthy)
                .filter(entry -> entry.hasTool(toolName))
                .sorted(Comparator.comparing(ServiceRegistryEntry::serviceName))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public RegistryStatus getStatus() {
        List<ServiceRegistryEntry> sorted = entries.values().stream()
                .sorted(Comparator.comparing(ServiceRegistryEntry::serviceName))
                .toList();
        int healthy = (int) sorted.stream().filter(ServiceRegistryEntry::healthy).count();
        return new RegistryStatus(sorted.size(), healthy, lastDiscoveryAt, sorted);
    }
}
