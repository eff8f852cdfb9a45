package com.flagship.inventory_valuation.gl;

import java.math.BigDecimal;
import java.util.List;

/**
 * Inventory documents that produce GL journals.
 *
 * Each constant owns its journal source names and its debit/credit pairing,
 * so adding a document kind forces a pairing to be written for it.
 */
public enum GlDocumentType {

    /**
     * Dr Inventory Asset, Cr GRNI. Non-positive values are skipped.
     */
    GOODS_RECEIPT("INV_GOODS_RECEIPT", "INV_GOODS_RECEIPT_VOID", "Goods Receipt") {
        @Override
        public boolean skips(BigDecimal amount) {
            return amount.signum() <= 0;
        }

        @Override
        List<JournalLineDraft> pair(PostingMapping mapping, BigDecimal amount) {
            return List.of(
                JournalLineDraft.debit(mapping.getInventoryAssetAccountId(), amount, "INVENTORY_ASSET_INCREASE"),
                JournalLineDraft.credit(mapping.getGrniAccountId(), amount, "GRNI_LIABILITY_INCREASE"));
        }
    },

    /**
     * Dr COGS, Cr Inventory Asset. The amount is taken as an absolute value.
     */
    DEPLETION("INV_DEPLETION", null, "COGS Depletion") {
        @Override
        List<JournalLineDraft> pair(PostingMapping mapping, BigDecimal amount) {
            BigDecimal value = amount.abs();
            return List.of(
                JournalLineDraft.debit(mapping.getCogsAccountId(), value, "COGS_EXPENSE"),
                JournalLineDraft.credit(mapping.getInventoryAssetAccountId(), value, "INVENTORY_ASSET_DECREASE"));
        }
    },

    /**
     * Dr Waste Expense, Cr Inventory Asset.
     */
    WASTE("INV_WASTE", "INV_WASTE_VOID", "Waste") {
        @Override
        List<JournalLineDraft> pair(PostingMapping mapping, BigDecimal amount) {
            BigDecimal value = amount.abs();
            return List.of(
                JournalLineDraft.debit(mapping.getWasteExpenseAccountId(), value, "WASTE_EXPENSE"),
                JournalLineDraft.credit(mapping.getInventoryAssetAccountId(), value, "INVENTORY_ASSET_DECREASE"));
        }
    },

    /**
     * Signed variance value. A gain debits Inventory Asset and credits Inventory
     * Gain, or Shrink when no gain account is mapped. A shrink debits Shrink
     * Expense and credits Inventory Asset.
     */
    STOCKTAKE("INV_STOCKTAKE", "INV_STOCKTAKE_VOID", "Stocktake Variance") {
        @Override
        List<JournalLineDraft> pair(PostingMapping mapping, BigDecimal amount) {
            BigDecimal value = amount.abs();
            if (amount.signum() > 0) {
                return List.of(
                    JournalLineDraft.debit(mapping.getInventoryAssetAccountId(), value, "INVENTORY_ASSET_INCREASE"),
                    JournalLineDraft.credit(mapping.gainOrShrinkAccountId(), value, "INVENTORY_GAIN"));
            }
            return List.of(
                JournalLineDraft.debit(mapping.getShrinkExpenseAccountId(), value, "SHRINK_EXPENSE"),
                JournalLineDraft.credit(mapping.getInventoryAssetAccountId(), value, "INVENTORY_ASSET_DECREASE"));
        }

        @Override
        String memo(String sourceId, BigDecimal amount) {
            return super.memo(sourceId, amount) + (amount.signum() > 0 ? " (Gain)" : " (Shrinkage)");
        }
    };

    private final String source;
    private final String voidSource;
    private final String label;

    GlDocumentType(String source, String voidSource, String label) {
        this.source = source;
        this.voidSource = voidSource;
        this.label = label;
    }

    public String getSource() {
        return source;
    }

    /**
     * Journal source of the reversal entry, or null when the kind cannot be voided.
     */
    public String getVoidSource() {
        return voidSource;
    }

    public boolean isVoidable() {
        return voidSource != null;
    }

    /**
     * Whether this amount produces no journal at all.
     */
    public boolean skips(BigDecimal amount) {
        return amount.signum() == 0;
    }

    /**
     * Balanced lines for the amount. Callers must check {@link #skips} first.
     */
    abstract List<JournalLineDraft> pair(PostingMapping mapping, BigDecimal amount);

    String memo(String sourceId, BigDecimal amount) {
        return label + ": " + sourceId;
    }

    String voidMemo(String sourceId) {
        return "Void " + label + ": " + sourceId;
    }
}
