package com.infomedia.abacox.callshipping.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Operator override of one engine setting. Settings without a row fall back to the
 * environment and then to the built-in default.
 */
@Entity
@Table(name = "config_value",
        uniqueConstraints = @UniqueConstraint(name = "uk_config_value_group_key", columnNames = {"config_group", "config_key"}))
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class ConfigValue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "config_group", nullable = false, length = 100)
    private String group;

    @Column(name = "config_key", nullable = false, length = 100)
    private String key;

    // null clears the override
    @Column(name = "config_value", length = 1024)
    private String value;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
