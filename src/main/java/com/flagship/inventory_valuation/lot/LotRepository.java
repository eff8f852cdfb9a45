package com.flagship.inventory_valuation.lot;

import com.flagship.inventory_valuation.ledger.LedgerSourceType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for lot aggregates.
 */
@Repository
public interface LotRepository extends JpaRepository<LotEntity, UUID>, JpaSpecificationExecutor<LotEntity> {

    /**
     * Loads a lot with a row lock so concurrent decrements serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LotEntity l WHERE l.id = :id")
    Optional<LotEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<LotEntity> findByOrgIdAndBranchIdAndItemIdAndLocationIdAndLotNumber(
        UUID orgId, UUID branchId, UUID itemId, UUID locationId, String lotNumber);

    List<LotEntity> findByOrgIdAndSourceTypeAndSourceIdOrderByCreatedAtAsc(
        UUID orgId, LedgerSourceType sourceType, String sourceId);

    /**
     * Candidate lots for FEFO. Ordering is applied in memory by {@link FefoAllocator}.
     */
    @Query("""
        SELECT l FROM LotEntity l
        WHERE l.orgId = :orgId AND l.branchId = :branchId
          AND l.itemId = :itemId AND l.locationId = :locationId
          AND l.status = com.flagship.inventory_valuation.lot.LotStatus.ACTIVE
          AND l.remainingQty > 0
        """)
    List<LotEntity> findAllocatable(@Param("orgId") UUID orgId,
                                    @Param("branchId") UUID branchId,
                                    @Param("itemId") UUID itemId,
                                    @Param("locationId") UUID locationId);

    @Query("""
        SELECT l FROM LotEntity l
        WHERE l.orgId = :orgId
          AND l.status = com.flagship.inventory_valuation.lot.LotStatus.ACTIVE
          AND l.remainingQty > 0
          AND l.expiryDate >= :from AND l.expiryDate <= :to
        ORDER BY l.expiryDate ASC, l.createdAt ASC
        """)
    List<LotEntity> findExpiringBetween(@Param("orgId") UUID orgId,
                                        @Param("from") LocalDate from,
                                        @Param("to") LocalDate to);

    @Query("""
        SELECT l FROM LotEntity l
        WHERE l.orgId = :orgId AND l.branchId = :branchId
          AND l.status = com.flagship.inventory_valuation.lot.LotStatus.ACTIVE
          AND l.remainingQty > 0
          AND l.expiryDate >= :from AND l.expiryDate <= :to
        ORDER BY l.expiryDate ASC, l.createdAt ASC
        """)
    List<LotEntity> findExpiringBetweenInBranch(@Param("orgId") UUID orgId,
                                                @Param("branchId") UUID branchId,
                                                @Param("from") LocalDate from,
                                                @Param("to") LocalDate to);

    /**
     * Flips ACTIVE lots past their expiry to EXPIRED.
     */
    @Modifying
    @Query("""
        UPDATE LotEntity l SET l.status = com.flagship.inventory_valuation.lot.LotStatus.EXPIRED
        WHERE l.status = com.flagship.inventory_valuation.lot.LotStatus.ACTIVE
          AND l.quarantined = false
          AND l.expiryDate < :today
          AND l.remainingQty > 0
        """)
    int markExpired(@Param("today") LocalDate today);

    @Modifying
    @Query("""
        UPDATE LotEntity l SET l.status = com.flagship.inventory_valuation.lot.LotStatus.EXPIRED
        WHERE l.orgId = :orgId
          AND l.status = com.flagship.inventory_valuation.lot.LotStatus.ACTIVE
          AND l.quarantined = false
          AND l.expiryDate < :today
          AND l.remainingQty > 0
        """)
    int markExpiredForOrg(@Param("orgId") UUID orgId, @Param("today") LocalDate today);

    /**
     * ACTIVE lots already past expiry that the sweep has not flipped yet.
     */
    @Query("""
        SELECT COUNT(l) FROM LotEntity l
        WHERE l.status = com.flagship.inventory_valuation.lot.LotStatus.ACTIVE
          AND l.quarantined = false
          AND l.expiryDate < :today
          AND l.remainingQty > 0
        """)
    long countAwaitingExpiry(@Param("today") LocalDate today);
}
