package com.infomedia.abacox.callshipping.component.classification.tenant;

/**
 * A resolved tenant and the strategy that produced it. An empty tenant means nothing matched
 * and no default is configured.
 */
public record TenantMatch(String tenant, String strategy) {

    public static final String NONE = "none";
    public static final String CACHE = "cache";

    public static TenantMatch none() {
        return new TenantMatch("", NONE);
    }

    public boolean isResolved() {
        return tenant != null && !tenant.isEmpty();
    }
}
