package com.infomedia.abacox.callshipping.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Engine-wide persisted values such as the startup watermark and feed checkpoints.
 */
@Entity
@Table(name = "engine_state")
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class EngineState {

    @Id
    @Column(name = "state_key", length = 100, nullable = false)
    private String key;

    @Column(name = "state_value", length = 1024)
    private String value;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
