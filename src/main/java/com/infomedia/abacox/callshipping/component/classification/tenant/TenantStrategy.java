package com.infomedia.abacox.callshipping.component.classification.tenant;

import java.util.Optional;

/**
 * One source of tenant evidence. Strategies are evaluated in their {@code @Order} and the first
 * one returning a value wins.
 */
public interface TenantStrategy {

    String getName();

    Optional<String> resolve(TenantResolutionInput input);

    /**
     * Whether a match may be kept for the rest of the call. Strategies whose evidence a
     * higher-priority strategy can still outrank once more records arrive return false.
     */
    default boolean isCacheable() {
        return true;
    }
}
