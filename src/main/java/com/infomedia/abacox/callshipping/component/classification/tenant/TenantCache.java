package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigService;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Linked id to tenant cache with a time to live. When the size cap is exceeded the oldest
 * entries are pruned down to half the cap.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class TenantCache {

    private record Entry(TenantMatch match, Instant storedAt) {
    }

    private static final List<ConfigKey> TENANT_RULE_KEYS = List.of(ConfigKey.DID_TENANT_MAP,
            ConfigKey.ACCOUNTCODE_TENANT_MAP, ConfigKey.KNOWN_TRUNKS, ConfigKey.DEFAULT_TENANT);

    private final EngineConfigService engineConfig;
    private final ConfigService configService;
    private final Clock clock;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (ConfigKey key : TENANT_RULE_KEYS) {
            configService.registerUpdateCallback(key, value -> {
                log.info("Tenant rule {} changed, clearing {} cached tenants", key.getKey(), entries.size());
                clear();
            });
        }
    }

    public Optional<TenantMatch> get(String linkedId) {
        Entry entry = entries.get(linkedId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.storedAt().plus(engineConfig.getTenantCacheTtl()).isBefore(clock.instant())) {
            entries.remove(linkedId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.match());
    }

    public void put(String linkedId, TenantMatch match) {
        entries.put(linkedId, new Entry(match, clock.instant()));
        int maxSize = engineConfig.getTenantCacheMaxSize();
        if (entries.size() > maxSize) {
            prune(maxSize / 2);
        }
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private synchronized void prune(int targetSize) {
        if (entries.size() <= targetSize) {
            return;
        }
        List<Map.Entry<String, Entry>> snapshot = new ArrayList<>(entries.entrySet());
        snapshot.sort(Map.Entry.comparingByValue((a, b) -> a.storedAt().compareTo(b.storedAt())));
        int toRemove = snapshot.size() - targetSize;
        for (int i = 0; i < toRemove; i++) {
            entries.remove(snapshot.get(i).getKey(), snapshot.get(i).getValue());
        }
        log.debug("Pruned tenant cache to {} entries", entries.size());
    }
}
