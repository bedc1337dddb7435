package com.infomedia.abacox.callshipping.component.configmanager;

import com.infomedia.abacox.callshipping.db.entity.ConfigValue;
import com.infomedia.abacox.callshipping.db.repository.ConfigValueRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Resolves configuration values in three layers: a persisted override in the state store,
 * then the Spring environment, then the enum default.
 */
@Service
@Log4j2
public class ConfigValueService {

    private static final Object NULL_PLACEHOLDER = new Object();

    private final ConfigValueRepository repository;
    private final Environment environment;

    // Group -> Key -> Value, persisted overrides only
    private volatile Map<String, Map<String, Object>> overrideCache;

    // Group:Key -> List of Consumers
    private final Map<String, List<Consumer<Value>>> updateCallbacks = new ConcurrentHashMap<>();

    public ConfigValueService(ConfigValueRepository repository, Environment environment) {
        this.repository = repository;
        this.environment = environment;
    }

    private Object encodeValue(String value) {
        return value == null ? NULL_PLACEHOLDER : value;
    }

    private String decodeValue(Object storedValue) {
        return storedValue == NULL_PLACEHOLDER ? null : (String) storedValue;
    }

    private String getCallbackKey(String group, String key) {
        return group + ":" + key;
    }

    private Map<String, Map<String, Object>> ensureCacheLoaded() {
        Map<String, Map<String, Object>> cache = overrideCache;
        if (cache != null) {
            return cache;
        }
        synchronized (this) {
            if (overrideCache != null) {
                return overrideCache;
            }
            Map<String, Map<String, Object>> loaded = new ConcurrentHashMap<>();
            try {
                repository.findAll().forEach(configValue -> loaded
                        .computeIfAbsent(configValue.getGroup(), k -> new ConcurrentHashMap<>())
                        .put(configValue.getKey(), encodeValue(configValue.getValue())));
                log.debug("Loaded {} persisted configuration groups", loaded.size());
            } catch (Exception e) {
                // Store an empty map so we don't retry DB calls endlessly on every get()
                log.warn("Could not load persisted configuration overrides, using environment and defaults: {}", e.getMessage());
            }
            overrideCache = loaded;
            return loaded;
        }
    }

    public Value getValue(String group, String configKey, String propertyName, String defaultValue) {
        Map<String, Object> groupCache = ensureCacheLoaded().get(group);
        if (groupCache != null && groupCache.containsKey(configKey)) {
            return new Value(group, configKey, decodeValue(groupCache.get(configKey)));
        }
        String fromEnvironment = propertyName == null ? null : environment.getProperty(propertyName);
        if (fromEnvironment != null) {
            return new Value(group, configKey, fromEnvironment);
        }
        return new Value(group, configKey, defaultValue);
    }

    @Transactional
    public void setValue(String group, String configKey, String newValue) {
        Map<String, Map<String, Object>> cache = ensureCacheLoaded();
        Map<String, Object> groupCache = cache.computeIfAbsent(group, k -> new ConcurrentHashMap<>());
        if (groupCache.containsKey(configKey) && Objects.equals(decodeValue(groupCache.get(configKey)), newValue)) {
            return;
        }

        ConfigValue configValue = repository.findByGroupAndKey(group, configKey)
                .orElseGet(() -> ConfigValue.builder().group(group).key(configKey).build());
        configValue.setValue(newValue);
        configValue.setUpdatedAt(Instant.now());
        repository.save(configValue);

        groupCache.put(configKey, encodeValue(newValue));
        log.info("Updated config '{}' in group '{}'.", configKey, group);

        onUpdateValue(group, configKey, newValue);
    }

    public void registerUpdateCallback(String group, String configKey, Consumer<Value> callback) {
        updateCallbacks.computeIfAbsent(getCallbackKey(group, configKey), k -> new CopyOnWriteArrayList<>()).add(callback);
    }

    private void onUpdateValue(String group, String configKey, String value) {
        Value changedValue = new Value(group, configKey, value);
        List<Consumer<Value>> keyCallbacks = updateCallbacks.get(getCallbackKey(group, configKey));
        if (keyCallbacks != null) {
            keyCallbacks.forEach(cb -> {
                try {
                    cb.accept(changedValue);
                } catch (Exception e) {
                    log.error("Error executing config update callback for {}:{}", group, configKey, e);
                }
            });
        }
    }
}
