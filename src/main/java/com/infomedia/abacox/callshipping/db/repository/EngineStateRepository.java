package com.infomedia.abacox.callshipping.db.repository;

import com.infomedia.abacox.callshipping.db.entity.EngineState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EngineStateRepository extends JpaRepository<EngineState, String> {
}
