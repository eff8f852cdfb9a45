package com.flagship.inventory_valuation.lot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically moves lots past their expiry date to EXPIRED so they drop out
 * of FEFO candidate lists.
 */
@Component
@ConditionalOnProperty(name = "inventory.lots.expiry-sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LotExpiryScheduler {

    private final LotService lotService;

    @Scheduled(cron = "${inventory.lots.expiry-sweep-cron:0 0 * * * *}")
    public void sweepExpiredLots() {
        try {
            lotService.markExpiredLots(null);
        } catch (Exception e) {
            log.error("Lot expiry sweep failed", e);
        }
    }
}
