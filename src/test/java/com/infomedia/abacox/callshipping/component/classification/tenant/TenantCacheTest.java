package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigService;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static com.infomedia.abacox.callshipping.component.EngineFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class TenantCacheTest {

    private EngineFixtures.MutableClock clock;
    private ConfigService configService;
    private TenantCache cache;

    @BeforeEach
    void setUp() {
        clock = new EngineFixtures.MutableClock(T0);
        configService = EngineFixtures.configService(Map.of(
                ConfigKey.TENANT_CACHE_TTL_SECONDS, "60",
                ConfigKey.TENANT_CACHE_MAX_SIZE, "4"));
        cache = new TenantCache(new EngineConfigService(configService), configService, clock);
        cache.init();
    }

    @Test
    void testEntriesExpireAfterTtl() {
        cache.put("1714564800.1", new TenantMatch("acme", "did"));

        clock.advance(Duration.ofSeconds(60));
        assertEquals("acme", cache.get("1714564800.1").orElseThrow().tenant());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("1714564800.1").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void testOldestEntriesArePrunedPastCap() {
        for (int i = 1; i <= 5; i++) {
            cache.put("1714564800." + i, new TenantMatch("t" + i, "cdr_fields"));
            clock.advance(Duration.ofSeconds(1));
        }

        assertEquals(2, cache.size());
        assertTrue(cache.get("1714564800.1").isEmpty());
        assertTrue(cache.get("1714564800.5").isPresent());
    }

    @Test
    void testTenantRuleChangeClearsCache() {
        cache.put("1714564800.1", new TenantMatch("acme", "did"));
        cache.put("1714564800.2", new TenantMatch("globex", "account_code"));

        configService.updateValue(ConfigKey.DID_TENANT_MAP, "6478752300:Initech");

        assertEquals(0, cache.size());
    }

    @Test
    void testUnrelatedChangeKeepsCache() {
        cache.put("1714564800.1", new TenantMatch("acme", "did"));

        configService.updateValue(ConfigKey.BATCH_SIZE, "50");

        assertEquals(1, cache.size());
    }
}
