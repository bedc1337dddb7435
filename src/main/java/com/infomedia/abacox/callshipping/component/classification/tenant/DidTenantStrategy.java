package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.PhoneNumberUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exact lookup of the dialed number in the DID map. Both the 10-digit and the 1-prefixed
 * 11-digit form of a configured DID match.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class DidTenantStrategy implements TenantStrategy {

    private final EngineConfigService engineConfig;
    private final TenantValidator validator;

    private volatile List<String> parsedEntries;
    private volatile Map<String, String> didMap = Map.of();

    @Override
    public String getName() {
        return "did";
    }

    @Override
    public Optional<String> resolve(TenantResolutionInput input) {
        Map<String, String> map = currentMap();
        if (map.isEmpty()) {
            return Optional.empty();
        }
        String did = input.endpoints() == null ? null : input.endpoints().getDstNumber();
        Optional<String> tenant = lookup(map, did);
        if (tenant.isPresent()) {
            return tenant;
        }
        for (CdrRecord cdr : input.group().getCdrs()) {
            tenant = lookup(map, cdr.getDst());
            if (tenant.isPresent()) {
                return tenant;
            }
        }
        return Optional.empty();
    }

    private Optional<String> lookup(Map<String, String> map, String number) {
        String digits = PhoneNumberUtil.digitsOnly(number);
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(map.get(digits)).map(validator::validate);
    }

    private Map<String, String> currentMap() {
        List<String> entries = engineConfig.getDidTenantMapEntries();
        if (!entries.equals(parsedEntries)) {
            Map<String, String> map = new HashMap<>();
            TenantMapParser.parse(entries).forEach((did, tenant) -> {
                String digits = PhoneNumberUtil.digitsOnly(did);
                map.put(digits, tenant);
                if (digits.length() == 11 && digits.startsWith("1")) {
                    map.put(digits.substring(1), tenant);
                } else if (digits.length() == 10) {
                    map.put("1" + digits, tenant);
                }
            });
            didMap = map;
            parsedEntries = entries;
        }
        return didMap;
    }
}
