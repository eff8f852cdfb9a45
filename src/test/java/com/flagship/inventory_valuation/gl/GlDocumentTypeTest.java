package com.flagship.inventory_valuation.gl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GlDocumentTypeTest {

    private final UUID asset = UUID.randomUUID();
    private final UUID cogs = UUID.randomUUID();
    private final UUID waste = UUID.randomUUID();
    private final UUID shrink = UUID.randomUUID();
    private final UUID grni = UUID.randomUUID();
    private final UUID gain = UUID.randomUUID();

    private PostingMapping mapping(UUID gainAccount) {
        return new PostingMapping(UUID.randomUUID(), null, asset, cogs, waste, shrink, grni, gainAccount);
    }

    private static BigDecimal debits(List<JournalLineDraft> lines) {
        return lines.stream().map(JournalLineDraft::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal credits(List<JournalLineDraft> lines) {
        return lines.stream().map(JournalLineDraft::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @ParameterizedTest
    @EnumSource(GlDocumentType.class)
    @DisplayName("Every pairing balances")
    void pairingsBalance(GlDocumentType type) {
        for (String amount : List.of("0.01", "125.50", "-42.125")) {
            if (type.skips(new BigDecimal(amount))) {
                continue;
            }
            List<JournalLineDraft> lines = type.pair(mapping(gain), new BigDecimal(amount));
            assertEquals(0, debits(lines).compareTo(credits(lines)), type + " " + amount);
            lines.forEach(line -> {
                assertTrue(line.getDebit().signum() >= 0);
                assertTrue(line.getCredit().signum() >= 0);
            });
        }
    }

    @Test
    @DisplayName("Goods receipt debits inventory and credits GRNI")
    void goodsReceipt() {
        List<JournalLineDraft> lines = GlDocumentType.GOODS_RECEIPT.pair(mapping(gain), new BigDecimal("100"));

        assertEquals(asset, lines.get(0).getAccountId());
        assertEquals(0, new BigDecimal("100").compareTo(lines.get(0).getDebit()));
        assertEquals(grni, lines.get(1).getAccountId());
        assertEquals(0, new BigDecimal("100").compareTo(lines.get(1).getCredit()));
    }

    @Test
    @DisplayName("Stocktake gain credits the gain account, or shrink when none is mapped")
    void stocktakeGain() {
        assertEquals(gain, GlDocumentType.STOCKTAKE.pair(mapping(gain), BigDecimal.TEN).get(1).getAccountId());
        assertEquals(shrink, GlDocumentType.STOCKTAKE.pair(mapping(null), BigDecimal.TEN).get(1).getAccountId());
    }

    @Test
    @DisplayName("Stocktake shrinkage debits shrink expense with the absolute value")
    void stocktakeShrink() {
        List<JournalLineDraft> lines = GlDocumentType.STOCKTAKE.pair(mapping(gain), new BigDecimal("-7.5"));

        assertEquals(shrink, lines.get(0).getAccountId());
        assertEquals(0, new BigDecimal("7.5").compareTo(lines.get(0).getDebit()));
        assertEquals(asset, lines.get(1).getAccountId());
        assertTrue(GlDocumentType.STOCKTAKE.memo("S-1", new BigDecimal("-7.5")).endsWith("(Shrinkage)"));
    }

    @Test
    @DisplayName("Skip rules: receipts skip non-positive values, others only zero")
    void skipRules() {
        assertTrue(GlDocumentType.GOODS_RECEIPT.skips(BigDecimal.ZERO));
        assertTrue(GlDocumentType.GOODS_RECEIPT.skips(new BigDecimal("-1")));
        assertTrue(GlDocumentType.WASTE.skips(BigDecimal.ZERO));
        assertFalse(GlDocumentType.STOCKTAKE.skips(new BigDecimal("-1")));
        assertFalse(GlDocumentType.DEPLETION.isVoidable());
        assertNull(GlDocumentType.DEPLETION.getVoidSource());
    }
}
