package com.flagship.inventory_valuation.reconciliation;

import com.flagship.inventory_valuation.costing.CostingService;
import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.ledger.BalanceDrift;
import com.flagship.inventory_valuation.ledger.StockLedgerService;
import com.flagship.inventory_valuation.observability.InventoryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Compares physical counts and cached balances against the ledger.
 *
 * Variances are valued at the same WAC the costing engine reports, so a
 * stocktake posting and a valuation report never disagree on unit cost.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockReconciliationService {

    private final StockLedgerService ledgerService;
    private final CostingService costingService;
    private final VarianceTolerancePolicy tolerancePolicy;
    private final InventoryMetrics metrics;

    /**
     * Variance of a count against current ledger on-hand.
     */
    @Transactional(readOnly = true)
    public VarianceResult computeVariance(UUID itemId, UUID locationId, UUID branchId, BigDecimal countedQty) {
        BigDecimal expected = ledgerService.getOnHand(itemId, locationId, branchId);
        return computeVariance(itemId, locationId, expected, countedQty);
    }

    public VarianceResult computeVariance(UUID itemId, UUID locationId, BigDecimal expectedQty, BigDecimal countedQty) {
        if (countedQty == null || countedQty.signum() < 0) {
            throw new ValidationException("Counted quantity must be zero or positive");
        }
        BigDecimal wac = costingService.getWac(itemId);
        BigDecimal varianceQty = countedQty.subtract(expectedQty);
        BigDecimal varianceValue = varianceQty.multiply(wac);
        boolean within = tolerancePolicy.isWithinTolerance(varianceValue, expectedQty.multiply(wac));

        if (!within) {
            log.info("Count variance outside tolerance: item={}, location={}, expected={}, counted={}, value={}",
                itemId, locationId, expectedQty, countedQty, varianceValue);
        }
        return new VarianceResult(itemId, locationId, expectedQty, countedQty, varianceQty, wac, varianceValue, within);
    }

    /**
     * Rebuilds the cached balance table of an org from the ledger and reports what had drifted.
     */
    @Transactional
    public List<BalanceDrift> reconcileBalances(UUID orgId) {
        if (orgId == null) {
            throw new ValidationException("Org is required for balance reconciliation");
        }
        List<BalanceDrift> drifts = ledgerService.rebuildBalances(orgId);
        if (drifts.isEmpty()) {
            log.debug("Cached balances of org {} match the ledger", orgId);
        } else {
            metrics.recordBalanceDrift(drifts.size());
            log.warn("Repaired {} drifted balance rows for org {}", drifts.size(), orgId);
        }
        return drifts;
    }
}
