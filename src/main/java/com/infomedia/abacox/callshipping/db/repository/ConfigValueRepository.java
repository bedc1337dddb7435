package com.infomedia.abacox.callshipping.db.repository;

import com.infomedia.abacox.callshipping.db.entity.ConfigValue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ConfigValueRepository extends JpaRepository<ConfigValue, Long> {
    Optional<ConfigValue> findByGroupAndKey(String group, String key);
}
