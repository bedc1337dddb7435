package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Scans CDR fields for a tenant token. Fields are visited in reliability order across all legs:
 * contexts, then account and user fields, then channel names.
 */
@Component
@Order(3)
@Log4j2
@RequiredArgsConstructor
public class CdrFieldScanTenantStrategy implements TenantStrategy {

    static final List<Function<CdrRecord, String>> FIELD_ORDER = List.of(
            CdrRecord::getDcontext,
            CdrRecord::getContext,
            CdrRecord::getAccountCode,
            CdrRecord::getUserField,
            CdrRecord::getPeerAccount,
            cdr -> firstArgument(cdr.getLastData()),
            CdrRecord::getChannel,
            CdrRecord::getDstChannel);

    private final TenantTokenScanner scanner;

    @Override
    public String getName() {
        return "cdr_fields";
    }

    @Override
    public Optional<String> resolve(TenantResolutionInput input) {
        List<CdrRecord> cdrs = input.group().getCdrs();
        for (Function<CdrRecord, String> field : FIELD_ORDER) {
            for (CdrRecord cdr : cdrs) {
                Optional<String> tenant = scanner.scan(field.apply(cdr));
                if (tenant.isPresent()) {
                    return tenant;
                }
            }
        }
        return Optional.empty();
    }

    // Application options after the first comma are dial flags, not names
    private static String firstArgument(String lastData) {
        if (lastData == null) {
            return null;
        }
        int comma = lastData.indexOf(',');
        return comma < 0 ? lastData : lastData.substring(0, comma);
    }
}
