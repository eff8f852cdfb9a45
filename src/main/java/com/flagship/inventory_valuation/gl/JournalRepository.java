package com.flagship.inventory_valuation.gl;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to journal entries and their lines.
 *
 * The unique key on (org_id, source, source_id) is the idempotency guarantee:
 * {@link #insertHeaderIfAbsent} reports whether this call won the key.
 * Line balance is checked again by a deferred trigger at commit.
 */
@Repository
public class JournalRepository {

    private static final String ENTRY_COLUMNS =
        "id, org_id, branch_id, entry_date, memo, source, source_id, status, reverses_entry_id, " +
        "posted_by, posted_at, reversed_by, reversed_at";

    private static final String LINE_COLUMNS =
        "id, journal_entry_id, account_id, debit, credit, line_type, original_line_id, line_number";

    private final JdbcTemplate jdbcTemplate;

    public JournalRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<JournalEntry> findBySource(UUID orgId, String source, String sourceId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE org_id = ? AND source = ? AND source_id = ?",
            headerMapper(),
            orgId, source, sourceId
        ).stream().findFirst().map(this::withLines);
    }

    /**
     * Same as {@link #findBySource} but locks the header row.
     */
    public Optional<JournalEntry> findBySourceForUpdate(UUID orgId, String source, String sourceId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries " +
            "WHERE org_id = ? AND source = ? AND source_id = ? FOR UPDATE",
            headerMapper(),
            orgId, source, sourceId
        ).stream().findFirst().map(this::withLines);
    }

    public Optional<JournalEntry> findById(UUID id) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE id = ?",
            headerMapper(),
            id
        ).stream().findFirst().map(this::withLines);
    }

    /**
     * Inserts the header unless (org, source, sourceId) is already taken.
     * A concurrent uncommitted insert of the same key makes this call wait for it.
     *
     * @return true if the row was inserted
     */
    public boolean insertHeaderIfAbsent(UUID id, UUID orgId, UUID branchId, LocalDate entryDate, String memo,
                                        String source, String sourceId, UUID reversesEntryId,
                                        UUID postedBy, Instant postedAt) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO journal_entries " +
            "(id, org_id, branch_id, entry_date, memo, source, source_id, status, reverses_entry_id, posted_by, posted_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (org_id, source, source_id) DO NOTHING",
            id, orgId, branchId, Date.valueOf(entryDate), memo, source, sourceId,
            JournalEntryStatus.POSTED.name(), reversesEntryId, postedBy, Timestamp.from(postedAt));
        return inserted == 1;
    }

    public void insertLines(UUID journalEntryId, List<JournalLineDraft> drafts, List<UUID> originalLineIds) {
        List<Object[]> batch = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            JournalLineDraft draft = drafts.get(i);
            batch.add(new Object[] {
                UUID.randomUUID(),
                journalEntryId,
                draft.getAccountId(),
                draft.getDebit(),
                draft.getCredit(),
                draft.getLineType(),
                originalLineIds != null ? originalLineIds.get(i) : null,
                i + 1
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_lines (" + LINE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            batch);
    }

    /**
     * Flips a POSTED entry to REVERSED.
     *
     * @return false if the entry was not POSTED
     */
    public boolean markReversed(UUID id, UUID reversedBy, Instant reversedAt) {
        return jdbcTemplate.update(
            "UPDATE journal_entries SET status = ?, reversed_by = ?, reversed_at = ? WHERE id = ? AND status = ?",
            JournalEntryStatus.REVERSED.name(), reversedBy, Timestamp.from(reversedAt), id,
            JournalEntryStatus.POSTED.name()) == 1;
    }

    public List<JournalLine> findLines(UUID journalEntryId) {
        return jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS + " FROM journal_lines WHERE journal_entry_id = ? ORDER BY line_number",
            lineMapper(),
            journalEntryId);
    }

    private JournalEntry withLines(JournalEntry header) {
        return new JournalEntry(
            header.getId(),
            header.getOrgId(),
            header.getBranchId(),
            header.getEntryDate(),
            header.getMemo(),
            header.getSource(),
            header.getSourceId(),
            header.getStatus(),
            header.getReversesEntryId(),
            header.getPostedBy(),
            header.getPostedAt(),
            header.getReversedBy(),
            header.getReversedAt(),
            findLines(header.getId()));
    }

    private RowMapper<JournalEntry> headerMapper() {
        return (rs, rowNum) -> new JournalEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("org_id")),
            uuid(rs, "branch_id"),
            rs.getDate("entry_date").toLocalDate(),
            rs.getString("memo"),
            rs.getString("source"),
            rs.getString("source_id"),
            JournalEntryStatus.valueOf(rs.getString("status")),
            uuid(rs, "reverses_entry_id"),
            uuid(rs, "posted_by"),
            instant(rs, "posted_at"),
            uuid(rs, "reversed_by"),
            instant(rs, "reversed_at"),
            List.of());
    }

    private RowMapper<JournalLine> lineMapper() {
        return (rs, rowNum) -> new JournalLine(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("journal_entry_id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getString("line_type"),
            uuid(rs, "original_line_id"),
            rs.getInt("line_number"));
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value != null ? value.toInstant() : null;
    }
}
