package com.infomedia.abacox.callshipping.component.configmanager;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Engine settings addressed by {@link ConfigKey}. Lookups go override, environment, default.
 */
@Service
@RequiredArgsConstructor
public class ConfigService {

    private final ConfigValueService configValueService;

    public Value getValue(ConfigKey configKey) {
        return configValueService.getValue(configKey.getGroup().name(), configKey.getKey(),
                configKey.getPropertyName(), configKey.getDefaultValue());
    }

    /**
     * Effective values of a group, keyed by camelCase name in declaration order.
     */
    public Map<String, String> getConfiguration(ConfigGroup group) {
        Map<String, String> values = new LinkedHashMap<>();
        ConfigKey.getKeys(group).forEach(key -> values.put(key.getKey(), getValue(key).asString()));
        return values;
    }

    public Optional<ConfigKey> findKey(ConfigGroup group, String name) {
        return ConfigKey.getKeys(group).stream().filter(key -> key.getKey().equals(name)).findFirst();
    }

    /**
     * Stores several overrides of one group. Nothing is written when any name is unknown.
     *
     * @throws IllegalArgumentException naming the first unknown key
     */
    public void updateConfiguration(ConfigGroup group, Map<String, String> newValues) {
        Map<ConfigKey, String> resolved = new LinkedHashMap<>();
        newValues.forEach((name, value) -> resolved.put(findKey(group, name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown key " + name + " in group " + group)), value));
        resolved.forEach(this::updateValue);
    }

    public void updateValue(ConfigKey configKey, Object newValue) {
        configValueService.setValue(configKey.getGroup().name(), configKey.getKey(),
                newValue == null ? null : newValue.toString());
    }

    public void registerUpdateCallback(ConfigKey configKey, Consumer<Value> callback) {
        configValueService.registerUpdateCallback(configKey.getGroup().name(), configKey.getKey(), callback);
    }
}
