package com.infomedia.abacox.callshipping.db.repository;

import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import com.infomedia.abacox.callshipping.db.entity.ShippingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ShippingRecordRepository extends JpaRepository<ShippingRecord, String> {

    List<ShippingRecord> findByDeliveryStatusIn(Collection<ShippingRecord.DeliveryStatus> statuses);

    @Modifying
    @Query("DELETE FROM ShippingRecord s WHERE s.lastShippedPhase = :phase " +
            "AND s.completeShippedAt < :cutoff AND s.deliveryStatus IN :statuses")
    int deleteSettledBefore(@Param("phase") ShippingPhase phase,
                            @Param("cutoff") Instant cutoff,
                            @Param("statuses") Collection<ShippingRecord.DeliveryStatus> statuses);
}
