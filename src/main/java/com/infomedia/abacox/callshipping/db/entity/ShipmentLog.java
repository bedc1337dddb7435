package com.infomedia.abacox.callshipping.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * One delivery outcome of one shipment, kept for operator inspection.
 */
@Entity
@Table(name = "shipment_log")
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class ShipmentLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "linked_id", length = 150, nullable = false)
    private String linkedId;

    @Column(name = "phase", length = 20, nullable = false)
    private String phase;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 20, nullable = false)
    private Outcome outcome;

    @Column(name = "attempt", nullable = false)
    private Integer attempt;

    @Column(name = "http_status")
    private Integer httpStatus;

    @Column(name = "content_hash", length = 32)
    private String contentHash;

    @Column(name = "message", length = 500)
    private String message;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public enum Outcome {
        DELIVERED,
        RETRY,
        REJECTED,
        FAILED
    }
}
