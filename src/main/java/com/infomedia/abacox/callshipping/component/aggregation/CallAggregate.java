package com.infomedia.abacox.callshipping.component.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.infomedia.abacox.callshipping.component.classification.CallDirection;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import com.infomedia.abacox.callshipping.component.normalizer.Disposition;
import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * The shippable view of one call. Serialized with snake_case names.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallAggregate {

    public static final String CONNECTOR = "asterisk";

    @JsonProperty("linkedid")
    private String linkedId;
    private CallDirection direction;

    private String srcNumber;
    private String srcExtension;
    private String srcName;
    private String srcExtensionName;
    private String dstNumber;
    private String dstExtension;
    private String dstName;
    private String dstExtensionName;

    private String tenant;
    private String tenantSource;

    private List<ThreadEntry> callThreads;

    private Instant startedAt;
    private Instant answeredAt;
    private Instant endedAt;
    private Disposition disposition;
    private long durationSeconds;
    private long billsec;
    @JsonProperty("is_long_call")
    private boolean longCall;

    private ShippingPhase shippingPhase;
    @JsonProperty("is_complete")
    private boolean complete;

    private boolean transferred;
    private boolean queueCall;
    private boolean voicemail;
    private boolean ivr;
    private boolean parked;
    private boolean conference;
    private boolean anonymousCaller;

    // Envelope
    @Builder.Default
    private String connector = CONNECTOR;
    private String connectorVersion;
    private Long customerId;
    private String hostname;
    private Instant shippedAt;

    private List<CdrRecord> rawCdrs;
    private List<CelRecord> rawCels;

    // Always derived from the threads themselves
    @JsonProperty(value = "call_threads_count", access = JsonProperty.Access.READ_ONLY)
    public int getCallThreadsCount() {
        return callThreads == null ? 0 : callThreads.size();
    }
}
