package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
@Order(Integer.MAX_VALUE)
@RequiredArgsConstructor
public class DefaultTenantStrategy implements TenantStrategy {

    public static final String NAME = "default";

    private final EngineConfigService engineConfig;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isCacheable() {
        return false;
    }

    @Override
    public Optional<String> resolve(TenantResolutionInput input) {
        String tenant = engineConfig.getDefaultTenant();
        return tenant.isEmpty() ? Optional.empty() : Optional.of(tenant.toLowerCase(Locale.ROOT));
    }
}
