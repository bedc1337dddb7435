package com.infomedia.abacox.callshipping.component.configmanager;

import com.infomedia.abacox.callshipping.db.entity.ConfigValue;
import com.infomedia.abacox.callshipping.db.repository.ConfigValueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConfigServiceTest {

    private ConfigValueRepository repository;
    private MockEnvironment environment;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        repository = mock(ConfigValueRepository.class);
        environment = new MockEnvironment();
        configService = new ConfigService(new ConfigValueService(repository, environment));
    }

    @Test
    void testPropertyNameFromEnumName() {
        assertEquals("longCallUpdateInterval", ConfigKey.LONG_CALL_UPDATE_INTERVAL.getKey());
        assertEquals("callshipping.shipping.longCallUpdateInterval", ConfigKey.LONG_CALL_UPDATE_INTERVAL.getPropertyName());
    }

    @Test
    void testDefaultWhenNothingConfigured() {
        assertEquals("600", configService.getValue(ConfigKey.LONG_CALL_UPDATE_INTERVAL).asString());
    }

    @Test
    void testEnvironmentOverridesDefault() {
        environment.setProperty("callshipping.shipping.longCallUpdateInterval", "900");

        assertEquals("900", configService.getValue(ConfigKey.LONG_CALL_UPDATE_INTERVAL).asString());
    }

    @Test
    void testPersistedOverrideWinsOverEnvironment() {
        environment.setProperty("callshipping.shipping.longCallUpdateInterval", "900");
        when(repository.findAll()).thenReturn(List.of(ConfigValue.builder()
                .group(ConfigGroup.SHIPPING.name()).key("longCallUpdateInterval").value("120").build()));

        assertEquals("120", configService.getValue(ConfigKey.LONG_CALL_UPDATE_INTERVAL).asString());
    }

    @Test
    void testUpdateSavesAndNotifiesOnce() {
        when(repository.findByGroupAndKey(any(), any())).thenReturn(Optional.empty());
        List<String> notified = new ArrayList<>();
        configService.registerUpdateCallback(ConfigKey.DEFAULT_TENANT, value -> notified.add(value.asString()));

        configService.updateValue(ConfigKey.DEFAULT_TENANT, "acme");
        configService.updateValue(ConfigKey.DEFAULT_TENANT, "acme");

        assertEquals(List.of("acme"), notified);
        assertEquals("acme", configService.getValue(ConfigKey.DEFAULT_TENANT).asString());
        verify(repository, times(1)).save(any(ConfigValue.class));
    }

    @Test
    void testGroupListingInDeclarationOrder() {
        List<String> keys = new ArrayList<>(configService.getConfiguration(ConfigGroup.DELIVERY).keySet());

        assertEquals("deliveryEnabled", keys.get(0));
        assertTrue(keys.contains("retryInitialBackoffSeconds"));
    }

    @Test
    void testUnreadableStoreFallsBackToEnvironment() {
        when(repository.findAll()).thenThrow(new IllegalStateException("store offline"));
        environment.setProperty("callshipping.api.apiKey", "from-env");

        assertEquals("from-env", configService.getValue(ConfigKey.API_KEY).asString());
    }

    @Test
    void testValueConversions() {
        assertTrue(new Value("FEED", "feedEnabled", " Yes ").asBoolean());
        assertFalse(new Value("FEED", "feedEnabled", "").asBoolean());
        assertEquals(List.of("a", "b"), new Value("CLASSIFICATION", "knownTrunks", " a, ,b,").asStringList());
        assertEquals(42, new Value("DELIVERY", "batchSize", " 42 ").asInt());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new Value("DELIVERY", "batchSize", "lots").asInt());
        assertTrue(e.getMessage().contains("DELIVERY.batchSize"));
        assertThrows(IllegalArgumentException.class, () -> new Value("DELIVERY", "batchSize", "3000000000").asInt());
    }

    @Test
    void testGroupUpdateRejectsUnknownKeyBeforeWriting() {
        Map<String, String> update = new LinkedHashMap<>();
        update.put("batchSize", "10");
        update.put("noSuchKey", "1");

        assertThrows(IllegalArgumentException.class, () -> configService.updateConfiguration(ConfigGroup.DELIVERY, update));
        verify(repository, never()).save(any(ConfigValue.class));
        assertEquals("100", configService.getValue(ConfigKey.BATCH_SIZE).asString());
    }
}
