package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of the account code in the account code map: exact match first, then the longest
 * configured prefix.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class AccountCodeTenantStrategy implements TenantStrategy {

    private final EngineConfigService engineConfig;
    private final TenantValidator validator;

    @Override
    public String getName() {
        return "accountcode";
    }

    @Override
    public Optional<String> resolve(TenantResolutionInput input) {
        Map<String, String> map = TenantMapParser.parse(engineConfig.getAccountCodeTenantMapEntries());
        if (map.isEmpty()) {
            return Optional.empty();
        }
        List<String> codes = new ArrayList<>();
        for (CdrRecord cdr : input.group().getCdrs()) {
            addCode(codes, cdr.getAccountCode());
        }
        for (CelRecord cel : input.group().getCels()) {
            addCode(codes, cel.getAccountCode());
        }
        for (String code : codes) {
            String tenant = findExact(map, code);
            if (tenant != null) {
                return Optional.ofNullable(validator.validate(tenant));
            }
        }
        for (String code : codes) {
            String tenant = findLongestPrefix(map, code);
            if (tenant != null) {
                return Optional.ofNullable(validator.validate(tenant));
            }
        }
        return Optional.empty();
    }

    private static void addCode(List<String> codes, String code) {
        if (code != null && !code.isBlank() && !codes.contains(code.trim())) {
            codes.add(code.trim());
        }
    }

    private static String findExact(Map<String, String> map, String code) {
        for (Map.Entry<String, String> entry : map.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(code)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String findLongestPrefix(Map<String, String> map, String code) {
        String lowerCode = code.toLowerCase(Locale.ROOT);
        String best = null;
        int bestLength = 0;
        for (Map.Entry<String, String> entry : map.entrySet()) {
            String prefix = entry.getKey().toLowerCase(Locale.ROOT);
            if (lowerCode.startsWith(prefix) && prefix.length() > bestLength) {
                best = entry.getValue();
                bestLength = prefix.length();
            }
        }
        return best;
    }
}
