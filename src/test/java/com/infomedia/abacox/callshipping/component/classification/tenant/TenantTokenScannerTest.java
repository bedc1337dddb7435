package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TenantTokenScannerTest {

    private final TenantValidator validator =
            new TenantValidator(EngineFixtures.config(Map.of(ConfigKey.KNOWN_TRUNKS, "rogers-trunk,bell")));
    private final TenantTokenScanner scanner = new TenantTokenScanner(validator);

    @Test
    void testInfrastructureWordsAreSkipped() {
        assertEquals(Optional.of("telair"), scanner.scan("closed-telair"));
        assertEquals(Optional.of("acme"), scanner.scan("from-did-direct-acme"));
        assertEquals(Optional.empty(), scanner.scan("SIP/sbc-ca2-00099"));
    }

    @Test
    void testConfiguredTrunkRemovedBeforeTokenSelection() {
        List<String> tokens = scanner.tokenize("SIP/telair-rogers-trunk-00001a");

        assertFalse(tokens.contains("rogers"));
        assertFalse(tokens.contains("trunk"));
        assertEquals(Optional.of("telair"), scanner.scan("SIP/telair-rogers-trunk-00001a"));
    }

    @Test
    void testTrunkPhraseOnlyRemovedAsWholeTokens() {
        assertEquals(Optional.of("bellcorp"), scanner.scan("SIP/bellcorp-0000001a"));
        assertEquals(Optional.empty(), scanner.scan("SIP/bell-0000001a"));
    }

    @Test
    void testRightmostValidTokenWins() {
        assertEquals(Optional.of("globex"), scanner.scan("acme_globex"));
    }

    @Test
    void testBlankFieldGivesNothing() {
        assertEquals(Optional.empty(), scanner.scan(""));
        assertEquals(Optional.empty(), scanner.scan(null));
    }
}
