package com.infomedia.abacox.callshipping.db.repository;

import com.infomedia.abacox.callshipping.db.entity.ShipmentLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ShipmentLogRepository extends JpaRepository<ShipmentLog, Long> {

    List<ShipmentLog> findTop20ByLinkedIdOrderByCreatedAtDesc(String linkedId);

    @Modifying
    @Query("DELETE FROM ShipmentLog l WHERE l.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
