package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.classification.CallEndpoints;
import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.metrics.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the tenant of a call by evaluating the ordered {@link TenantStrategy} beans.
 * Matches from cacheable strategies are cached per linked id. CEL scans and the default are
 * re-evaluated so a CDR arriving later can still outrank them.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class TenantResolutionService {

    private final List<TenantStrategy> strategies;
    private final TenantCache tenantCache;
    private final EngineMetrics metrics;

    public TenantMatch resolve(CorrelatedGroup group, CallEndpoints endpoints) {
        String linkedId = group.getLinkedId();
        Optional<TenantMatch> cached = tenantCache.get(linkedId);
        if (cached.isPresent()) {
            metrics.tenantCacheHit();
            return cached.get();
        }
        metrics.tenantCacheMiss();

        TenantResolutionInput input = new TenantResolutionInput(group, endpoints);
        for (TenantStrategy strategy : strategies) {
            Optional<String> tenant;
            try {
                tenant = strategy.resolve(input);
            } catch (RuntimeException e) {
                log.warn("Tenant strategy {} failed for call {}", strategy.getName(), linkedId, e);
                continue;
            }
            if (tenant.isPresent() && !tenant.get().isEmpty()) {
                TenantMatch match = new TenantMatch(tenant.get(), strategy.getName());
                metrics.tenantResolved(strategy.getName());
                if (strategy.isCacheable()) {
                    tenantCache.put(linkedId, match);
                }
                log.debug("Call {} resolved to tenant {} by {}", linkedId, match.tenant(), match.strategy());
                return match;
            }
        }
        metrics.tenantResolved(TenantMatch.NONE);
        return TenantMatch.none();
    }
}
