package com.flagship.inventory_valuation.movement;

import com.flagship.inventory_valuation.gl.GlPostingResult;
import com.flagship.inventory_valuation.ledger.OnHandResult;
import com.flagship.inventory_valuation.lot.LotMutation;
import com.flagship.inventory_valuation.reconciliation.VarianceResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one movement.
 *
 * {@code replayed} is true when the document had already been applied; the
 * ledger ids are then the ones written the first time and no lot changed.
 * {@code value} is the unrounded amount handed to the GL poster.
 */
@Value
@Builder
public class MovementResult {
    MovementKind kind;
    String sourceId;
    boolean replayed;
    @Singular
    List<UUID> ledgerEntryIds;
    @Singular
    List<OnHandResult> onHandSnapshots;
    @Singular
    List<UUID> createdLotIds;
    @Singular
    List<LotMutation> lotMutations;
    @Singular
    List<VarianceResult> variances;
    BigDecimal value;
    GlPostingResult glPosting;
}
