package com.infomedia.abacox.callshipping.controller;

import com.infomedia.abacox.callshipping.component.configmanager.ConfigGroup;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigService;
import com.infomedia.abacox.callshipping.dto.configuration.UpdateConfigurationDto;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@RequiredArgsConstructor
@RestController
@Tag(name = "Configuration", description = "Configuration controller")
@RequestMapping("/api/configuration")
public class ConfigController {

    private static final Set<ConfigKey> SECRET_KEYS = Set.of(ConfigKey.API_KEY, ConfigKey.CDR_SOURCE_PASSWORD, ConfigKey.AMI_PASSWORD);
    private static final String MASK = "********";

    private final ConfigService configService;

    @GetMapping(value = "{group}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> getConfiguration(@PathVariable("group") String group) {
        ConfigGroup configGroup = parseGroup(group);
        Map<String, String> values = new LinkedHashMap<>(configService.getConfiguration(configGroup));
        for (ConfigKey key : SECRET_KEYS) {
            if (key.getGroup() == configGroup && values.get(key.getKey()) != null && !values.get(key.getKey()).isEmpty()) {
                values.put(key.getKey(), MASK);
            }
        }
        return values;
    }

    @PatchMapping(value = "{group}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> updateConfiguration(@PathVariable("group") String group,
                                                   @Valid @RequestBody UpdateConfigurationDto update) {
        ConfigGroup configGroup = parseGroup(group);
        try {
            configService.updateConfiguration(configGroup, update.getValues());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return getConfiguration(group);
    }

    private static ConfigGroup parseGroup(String group) {
        try {
            return ConfigGroup.valueOf(group.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown configuration group " + group);
        }
    }
}
