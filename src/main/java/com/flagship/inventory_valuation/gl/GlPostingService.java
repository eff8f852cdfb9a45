package com.flagship.inventory_valuation.gl;

import com.flagship.inventory_valuation.audit.AuditEvent;
import com.flagship.inventory_valuation.audit.AuditEventSink;
import com.flagship.inventory_valuation.exception.PeriodLockedException;
import com.flagship.inventory_valuation.exception.UnconfiguredMappingException;
import com.flagship.inventory_valuation.exception.ValidationException;
import com.flagship.inventory_valuation.observability.InventoryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotent double-entry GL posting for inventory documents.
 *
 * Posting flow:
 * 1. Return the existing journal for (org, source, sourceId) if there is one
 * 2. Skip amounts that produce no journal
 * 3. Reject dates inside a LOCKED fiscal period (throws, never returned as a status)
 * 4. Resolve the account mapping; a missing mapping is reported as FAILED
 * 5. Write the balanced entry, letting the unique key settle concurrent retries
 *
 * All methods join the caller's transaction, so a period lock rolls back the
 * inventory movement that triggered the posting.
 */
@Service
@Slf4j
public class GlPostingService {

    static final String NOT_CONFIGURED = "GL integration not configured";

    private final JournalRepository journalRepository;
    private final PostingMappingResolver mappingResolver;
    private final FiscalPeriodLookup fiscalPeriodLookup;
    private final GlAccountDirectory accountDirectory;
    private final JournalIdempotencyCache idempotencyCache;
    private final AuditEventSink auditSink;
    private final InventoryMetrics metrics;
    private final Clock clock;

    public GlPostingService(JournalRepository journalRepository,
                            PostingMappingResolver mappingResolver,
                            FiscalPeriodLookup fiscalPeriodLookup,
                            GlAccountDirectory accountDirectory,
                            JournalIdempotencyCache idempotencyCache,
                            AuditEventSink auditSink,
                            InventoryMetrics metrics,
                            Clock clock) {
        this.journalRepository = journalRepository;
        this.mappingResolver = mappingResolver;
        this.fiscalPeriodLookup = fiscalPeriodLookup;
        this.accountDirectory = accountDirectory;
        this.idempotencyCache = idempotencyCache;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Dr Inventory Asset, Cr GRNI for a received document.
     */
    @Transactional
    public GlPostingResult postGoodsReceipt(UUID orgId, UUID branchId, String receiptId,
                                            BigDecimal totalValue, UUID actorId) {
        return post(GlDocumentType.GOODS_RECEIPT, orgId, branchId, receiptId, totalValue, actorId);
    }

    @Transactional
    public GlPostingResult postDepletion(UUID orgId, UUID branchId, String depletionId,
                                         BigDecimal cogsValue, UUID actorId) {
        return post(GlDocumentType.DEPLETION, orgId, branchId, depletionId, cogsValue, actorId);
    }

    @Transactional
    public GlPostingResult postWaste(UUID orgId, UUID branchId, String wasteId,
                                     BigDecimal wasteValue, UUID actorId) {
        return post(GlDocumentType.WASTE, orgId, branchId, wasteId, wasteValue, actorId);
    }

    /**
     * @param varianceValue positive for a gain, negative for shrinkage
     */
    @Transactional
    public GlPostingResult postStocktake(UUID orgId, UUID branchId, String sessionId,
                                         BigDecimal varianceValue, UUID actorId) {
        return post(GlDocumentType.STOCKTAKE, orgId, branchId, sessionId, varianceValue, actorId);
    }

    @Transactional
    public GlPostingResult voidGoodsReceipt(UUID orgId, UUID branchId, String receiptId, UUID actorId) {
        return reverse(GlDocumentType.GOODS_RECEIPT, orgId, branchId, receiptId, actorId);
    }

    @Transactional
    public GlPostingResult voidWaste(UUID orgId, UUID branchId, String wasteId, UUID actorId) {
        return reverse(GlDocumentType.WASTE, orgId, branchId, wasteId, actorId);
    }

    @Transactional
    public GlPostingResult voidStocktake(UUID orgId, UUID branchId, String sessionId, UUID actorId) {
        return reverse(GlDocumentType.STOCKTAKE, orgId, branchId, sessionId, actorId);
    }

    /**
     * Posts a document of any kind.
     */
    @Transactional
    public GlPostingResult post(GlDocumentType type, UUID orgId, UUID branchId, String sourceId,
                                BigDecimal amount, UUID actorId) {
        if (orgId == null || sourceId == null || sourceId.isBlank() || amount == null) {
            throw new ValidationException("Org, source id and amount are required for GL posting");
        }
        MDC.put("sourceId", sourceId);
        try {
            log.debug("Posting GL for {} {}, amount={}", type, sourceId, amount);

            Optional<UUID> cached = idempotencyCache.lookup(orgId, type.getSource(), sourceId);
            if (cached.isPresent()) {
                metrics.recordGlIdempotencyHit("redis");
                return GlPostingResult.alreadyPosted(cached.get());
            }
            Optional<JournalEntry> existing = journalRepository.findBySource(orgId, type.getSource(), sourceId);
            if (existing.isPresent()) {
                log.debug("GL already posted for {} {} (idempotent)", type, sourceId);
                metrics.recordGlIdempotencyHit("database");
                return GlPostingResult.alreadyPosted(existing.get().getId());
            }

            if (type.skips(amount)) {
                log.info("Skipping GL posting for {} {}: amount {}", type, sourceId, amount);
                metrics.recordGlPosting(type.name(), GlPostingStatus.SKIPPED.name());
                return GlPostingResult.skipped(amount.signum() == 0
                    ? "Zero amount"
                    : "Zero or negative " + type.name().toLowerCase() + " value");
            }

            LocalDate postingDate = LocalDate.now(clock);
            checkPeriodLock(orgId, postingDate);

            PostingMapping mapping;
            try {
                mapping = mappingResolver.resolveMapping(orgId, branchId);
            } catch (UnconfiguredMappingException e) {
                log.warn("GL posting for {} {} failed: {}", type, sourceId, e.getMessage());
                metrics.recordGlPosting(type.name(), GlPostingStatus.FAILED.name());
                return GlPostingResult.failed(NOT_CONFIGURED);
            }

            List<JournalLineDraft> lines = type.pair(mapping, amount);
            requireBalanced(lines, type, sourceId);

            UUID journalId = UUID.randomUUID();
            Instant now = Instant.now(clock);
            boolean inserted = journalRepository.insertHeaderIfAbsent(journalId, orgId, branchId, postingDate,
                type.memo(sourceId, amount), type.getSource(), sourceId, null, actorId, now);
            if (!inserted) {
                UUID winner = journalRepository.findBySource(orgId, type.getSource(), sourceId)
                    .map(JournalEntry::getId)
                    .orElseThrow(() -> new IllegalStateException(
                        "Journal key taken but no row found: " + type.getSource() + ":" + sourceId));
                log.info("Concurrent GL posting for {} {} won by journal {}", type, sourceId, winner);
                metrics.recordGlIdempotencyHit("constraint");
                return GlPostingResult.alreadyPosted(winner);
            }
            journalRepository.insertLines(journalId, lines, null);

            auditSink.record(AuditEvent.builder()
                .orgId(orgId)
                .branchId(branchId)
                .actorId(actorId)
                .action("gl.posting.created")
                .resourceType("JournalEntry")
                .resourceId(journalId)
                .metadata(Map.of(
                    "documentType", type.name(),
                    "documentId", sourceId,
                    "amount", amount.toPlainString()))
                .build());
            idempotencyCache.storeAfterCommit(orgId, type.getSource(), sourceId, journalId);
            metrics.recordGlPosting(type.name(), GlPostingStatus.POSTED.name());

            log.info("Created GL journal {} for {} {}, amount={}", journalId, type, sourceId, amount);
            return GlPostingResult.posted(journalId);
        } finally {
            MDC.remove("sourceId");
        }
    }

    /**
     * Reverses the journal of a document: a new entry with every line's debit and
     * credit swapped, referencing the original, which becomes REVERSED.
     *
     * A missing original, or one already reversed, is reported as SKIPPED and
     * writes nothing.
     */
    @Transactional
    public GlPostingResult reverse(GlDocumentType type, UUID orgId, UUID branchId, String sourceId, UUID actorId) {
        if (!type.isVoidable()) {
            throw new ValidationException(type + " journals cannot be voided");
        }
        MDC.put("sourceId", sourceId);
        try {
            Optional<JournalEntry> original = journalRepository.findBySourceForUpdate(orgId, type.getSource(), sourceId);
            if (original.isEmpty()) {
                log.info("No GL journal found for {}:{} to reverse", type.getSource(), sourceId);
                return GlPostingResult.skipped("No original journal to reverse");
            }

            Optional<JournalEntry> existingReversal =
                journalRepository.findBySource(orgId, type.getVoidSource(), sourceId);
            if (existingReversal.isPresent()) {
                log.debug("Reversal already exists for {} (idempotent)", sourceId);
                return GlPostingResult.alreadyReversed(existingReversal.get().getId());
            }
            JournalEntry posted = original.get();
            if (posted.getStatus() == JournalEntryStatus.REVERSED) {
                log.warn("Journal {} is REVERSED but has no {} entry", posted.getId(), type.getVoidSource());
                return GlPostingResult.skipped("Original journal already reversed");
            }

            LocalDate postingDate = LocalDate.now(clock);
            checkPeriodLock(orgId, postingDate);

            List<JournalLineDraft> swapped = new ArrayList<>(posted.getLines().size());
            List<UUID> originalLineIds = new ArrayList<>(posted.getLines().size());
            for (JournalLine line : posted.getLines()) {
                swapped.add(new JournalLineDraft(line.getAccountId(), line.getCredit(), line.getDebit(), "REVERSAL"));
                originalLineIds.add(line.getId());
            }
            requireBalanced(swapped, type, sourceId);

            UUID reversalId = UUID.randomUUID();
            Instant now = Instant.now(clock);
            boolean inserted = journalRepository.insertHeaderIfAbsent(reversalId, orgId, branchId, postingDate,
                type.voidMemo(sourceId), type.getVoidSource(), sourceId, posted.getId(), actorId, now);
            if (!inserted) {
                UUID winner = journalRepository.findBySource(orgId, type.getVoidSource(), sourceId)
                    .map(JournalEntry::getId)
                    .orElseThrow(() -> new IllegalStateException(
                        "Reversal key taken but no row found: " + type.getVoidSource() + ":" + sourceId));
                return GlPostingResult.alreadyReversed(winner);
            }
            journalRepository.insertLines(reversalId, swapped, originalLineIds);
            journalRepository.markReversed(posted.getId(), actorId, now);

            auditSink.record(AuditEvent.builder()
                .orgId(orgId)
                .branchId(branchId)
                .actorId(actorId)
                .action("gl.posting.reversed")
                .resourceType("JournalEntry")
                .resourceId(reversalId)
                .metadata(Map.of(
                    "originalJournalId", posted.getId().toString(),
                    "documentId", sourceId))
                .build());
            metrics.recordGlReversal(type.name());

            log.info("Created reversal journal {} for {}", reversalId, posted.getId());
            return GlPostingResult.posted(reversalId);
        } finally {
            MDC.remove("sourceId");
        }
    }

    /**
     * The lines a posting of this amount would write today. Writes nothing.
     *
     * @throws UnconfiguredMappingException if no mapping exists
     */
    @Transactional(readOnly = true)
    public PostingPreview previewPosting(UUID orgId, UUID branchId, GlDocumentType type, BigDecimal amount) {
        PostingMapping mapping = mappingResolver.resolveMapping(orgId, branchId);
        BigDecimal value = type == GlDocumentType.STOCKTAKE ? amount : amount.abs();

        List<PostingPreview.Line> lines = new ArrayList<>();
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;
        for (JournalLineDraft draft : type.pair(mapping, value)) {
            Optional<GlAccount> account = accountDirectory.findById(draft.getAccountId());
            lines.add(new PostingPreview.Line(
                draft.getAccountId(),
                account.map(GlAccount::getCode).orElse(""),
                account.map(GlAccount::getName).orElse(""),
                draft.getDebit(),
                draft.getCredit()));
            totalDebit = totalDebit.add(draft.getDebit());
            totalCredit = totalCredit.add(draft.getCredit());
        }
        return new PostingPreview(type, amount.abs(), List.copyOf(lines), totalDebit, totalCredit);
    }

    public Optional<JournalEntry> getJournal(UUID orgId, GlDocumentType type, String sourceId) {
        return journalRepository.findBySource(orgId, type.getSource(), sourceId);
    }

    public Optional<JournalEntry> getReversal(UUID orgId, GlDocumentType type, String sourceId) {
        if (!type.isVoidable()) {
            return Optional.empty();
        }
        return journalRepository.findBySource(orgId, type.getVoidSource(), sourceId);
    }

    public Optional<JournalEntry> getJournalEntry(UUID journalId) {
        return journalRepository.findById(journalId);
    }

    private void checkPeriodLock(UUID orgId, LocalDate postingDate) {
        Optional<FiscalPeriod> period = fiscalPeriodLookup.findPeriod(orgId, postingDate);
        if (period.isPresent() && period.get().isLocked()) {
            log.warn("Rejected GL posting on {} in locked period {}", postingDate, period.get().getName());
            throw new PeriodLockedException(period.get().getId(), period.get().getName(), postingDate);
        }
    }

    private static void requireBalanced(List<JournalLineDraft> lines, GlDocumentType type, String sourceId) {
        BigDecimal debit = BigDecimal.ZERO;
        BigDecimal credit = BigDecimal.ZERO;
        for (JournalLineDraft line : lines) {
            debit = debit.add(line.getDebit());
            credit = credit.add(line.getCredit());
        }
        if (debit.compareTo(credit) != 0) {
            throw new IllegalStateException(String.format(
                "Unbalanced journal for %s %s: debit=%s, credit=%s", type, sourceId, debit, credit));
        }
    }
}
