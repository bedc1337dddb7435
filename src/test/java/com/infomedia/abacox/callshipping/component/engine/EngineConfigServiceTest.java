package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EngineConfigServiceTest {

    @Test
    void testLocalHostnameResolvedOnce() {
        EngineConfigService config = spy(EngineFixtures.config());
        doReturn("pbx-01").when(config).resolveLocalHostname();

        assertEquals("pbx-01", config.getHostname());
        assertEquals("pbx-01", config.getHostname());
        assertEquals("pbx-01", config.getHostname());

        verify(config, times(1)).resolveLocalHostname();
    }

    @Test
    void testConfiguredHostnameSkipsLookup() {
        EngineConfigService config = spy(EngineFixtures.config(Map.of(ConfigKey.HOSTNAME, " edge-pbx ")));

        assertEquals("edge-pbx", config.getHostname());

        verify(config, never()).resolveLocalHostname();
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        EngineConfigService config = EngineFixtures.config(Map.of(ConfigKey.BATCH_SIZE, "many"));

        assertEquals(100, config.getBatchSize());
    }
}
