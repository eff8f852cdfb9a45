package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LotAllocationRepository extends JpaRepository<LotAllocationEntity, UUID> {

    List<LotAllocationEntity> findByLotIdOrderByCreatedAtAscAllocationOrderAsc(UUID lotId);

    List<LotAllocationEntity> findBySourceTypeAndSourceIdOrderByAllocationOrderAsc(
        LedgerSourceType sourceType, String sourceId);
}
