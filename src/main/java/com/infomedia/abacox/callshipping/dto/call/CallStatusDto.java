package com.infomedia.abacox.callshipping.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What the engine currently knows about one linked id.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallStatusDto {
    private String linkedId;
    private boolean inMemory;
    private boolean closed;
    private int recordCount;
    private boolean queued;
    private ShippingRecordDto shippingRecord;
    private List<ShipmentLogDto> recentShipments;
}
