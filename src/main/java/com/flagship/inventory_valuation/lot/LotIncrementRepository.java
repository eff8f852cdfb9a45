package com.flagship.inventory_valuation.lot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LotIncrementRepository extends JpaRepository<LotIncrementEntity, UUID> {

    List<LotIncrementEntity> findByLotIdOrderByCreatedAtAsc(UUID lotId);
}
