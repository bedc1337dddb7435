package com.infomedia.abacox.callshipping.component.shipping;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Decides whether the current aggregate of a call is shipped and in which phase.
 * <p>
 * In complete mode nothing ships until the call closes, except long-call heartbeats: an open call
 * ships an update each time its running time crosses another multiple of the long-call interval.
 * In progressive mode the first sighting ships as initial, each content change as update, and
 * closure as complete. After complete, a changed aggregate is re-shipped at most once.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class ShippingStateMachine {

    private final EngineConfigService engineConfig;

    public ShippingDecision decide(ShippingState state, boolean closed, String contentHash, Duration runningTime) {
        ShippingState current = state == null ? ShippingState.NEW : state;
        boolean sameContent = contentHash != null && contentHash.equals(current.contentHash());

        if (current.undelivered() && sameContent) {
            return ShippingDecision.ship(current.phase(), "redeliver", current.heartbeatCount());
        }

        if (current.phase() == ShippingPhase.SHIPPED_COMPLETE) {
            if (sameContent) {
                return ShippingDecision.skip("duplicate");
            }
            if (!engineConfig.isCorrectiveReshipEnabled()) {
                return ShippingDecision.skip("corrective_disabled");
            }
            if (current.correctiveReshipDone()) {
                return ShippingDecision.skip("corrective_exhausted");
            }
            return ShippingDecision.corrective("late_change", current.heartbeatCount());
        }

        if (closed) {
            return ShippingDecision.ship(ShippingPhase.SHIPPED_COMPLETE, "closed", current.heartbeatCount());
        }

        if (engineConfig.getShippingMode() == ShippingMode.PROGRESSIVE) {
            if (!current.isShipped()) {
                return ShippingDecision.ship(ShippingPhase.SHIPPED_INITIAL, "first_seen", 0);
            }
            if (sameContent) {
                return ShippingDecision.skip("unchanged");
            }
            return ShippingDecision.ship(ShippingPhase.SHIPPED_UPDATE, "changed", current.heartbeatCount());
        }

        int due = heartbeatsDue(runningTime);
        if (due > current.heartbeatCount()) {
            return ShippingDecision.ship(ShippingPhase.SHIPPED_UPDATE, "long_call", due);
        }
        return ShippingDecision.skip("open");
    }

    /**
     * Number of long-call intervals the call has been running for.
     */
    public int heartbeatsDue(Duration runningTime) {
        long interval = engineConfig.getLongCallUpdateIntervalSeconds();
        if (interval <= 0 || runningTime == null || runningTime.isNegative()) {
            return 0;
        }
        return (int) Math.min(Integer.MAX_VALUE, runningTime.getSeconds() / interval);
    }
}
