package com.infomedia.abacox.callshipping.component.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Counters and gauges emitted by the engine. Exposition is left to the registry.
 */
@Component
public class EngineMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter recordsDiscarded;
    private final Counter permanentFailures;
    private final Counter deliveryRejected;
    private final Counter tenantCacheHits;
    private final Counter tenantCacheMisses;

    public EngineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.recordsDiscarded = Counter.builder("callshipping.records.discarded")
                .description("Records without a usable linked id or unique id")
                .register(meterRegistry);
        this.permanentFailures = Counter.builder("callshipping.delivery.permanent_failures")
                .description("Shipments dropped after the retry deadline")
                .register(meterRegistry);
        this.deliveryRejected = Counter.builder("callshipping.delivery.rejected")
                .description("Shipments rejected by the API with a client error")
                .register(meterRegistry);
        this.tenantCacheHits = Counter.builder("callshipping.tenant.cache")
                .tag("result", "hit")
                .register(meterRegistry);
        this.tenantCacheMisses = Counter.builder("callshipping.tenant.cache")
                .tag("result", "miss")
                .register(meterRegistry);
    }

    public void recordProcessed(String type) {
        Counter.builder("callshipping.records.processed")
                .description("Normalized records applied to the correlation index")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    public void recordFiltered(String type, String reason) {
        Counter.builder("callshipping.records.filtered")
                .description("Records skipped before correlation")
                .tag("type", type)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordDiscarded() {
        recordsDiscarded.increment();
    }

    public void shipment(String phase, String outcome) {
        Counter.builder("callshipping.shipments")
                .tag("phase", phase)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void permanentFailure() {
        permanentFailures.increment();
    }

    public void deliveryRejected() {
        deliveryRejected.increment();
    }

    public void tenantCacheHit() {
        tenantCacheHits.increment();
    }

    public void tenantCacheMiss() {
        tenantCacheMisses.increment();
    }

    public void tenantResolved(String strategy) {
        Counter.builder("callshipping.tenant.resolved")
                .tag("strategy", strategy)
                .register(meterRegistry)
                .increment();
    }

    public void registerGauge(String name, String description, Supplier<Number> supplier) {
        Gauge.builder(name, supplier)
                .description(description)
                .register(meterRegistry);
    }
}
