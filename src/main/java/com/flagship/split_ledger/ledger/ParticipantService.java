package com.flagship.split_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ledger membership and current weights.
 *
 * Current weights only feed new drafts. Recorded expenses carry their own
 * snapshot, so nothing here touches existing expenses.
 */
@Service
@Slf4j
public class ParticipantService {

    private static final RowMapper<Participant> PARTICIPANT_ROW_MAPPER = (rs, rowNum) -> new Participant(
        rs.getLong("ledger_id"),
        rs.getLong("participant_id"),
        rs.getString("name"),
        rs.getBigDecimal("weight")
    );

    private final JdbcTemplate jdbcTemplate;

    public ParticipantService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Registers a real user in the ledger, or renames them if the name changed.
     * A newly registered member starts with weight 1.
     */
    @Transactional
    public Participant ensureMember(long ledgerId, long userId, String name) {
        if (userId <= 0) {
            throw new IllegalArgumentException("User id must be positive: " + userId);
        }
        String displayName = requireName(name);
        jdbcTemplate.update(
            "INSERT INTO participants (ledger_id, participant_id, name, weight) VALUES (?, ?, ?, 1) " +
            "ON CONFLICT (ledger_id, participant_id) DO UPDATE SET name = EXCLUDED.name",
            ledgerId,
            userId,
            displayName
        );
        return find(ledgerId, userId)
            .orElseThrow(() -> new IllegalStateException("Participant vanished after upsert: " + userId));
    }

    /**
     * Adds a participant without an account, allocating the next negative id
     * of the ledger (-1, -2, ...).
     *
     * @throws IllegalStateException if the ledger already has a participant with that name
     */
    @Transactional
    public Participant addVirtual(long ledgerId, String name) {
        String displayName = requireName(name);

        // Row lock on the ledger serializes allocations
        List<Long> allocated = jdbcTemplate.queryForList(
            "UPDATE ledgers SET virtual_seq = virtual_seq - 1 WHERE id = ? RETURNING virtual_seq",
            Long.class,
            ledgerId
        );
        if (allocated.isEmpty()) {
            throw new IllegalArgumentException("Ledger not found: " + ledgerId);
        }

        Long duplicates = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM participants WHERE ledger_id = ? AND LOWER(name) = LOWER(?)",
            Long.class,
            ledgerId,
            displayName
        );
        if (duplicates != null && duplicates > 0) {
            throw new IllegalStateException(
                String.format("Ledger %d already has a participant named '%s'", ledgerId, displayName));
        }

        long participantId = allocated.get(0);
        jdbcTemplate.update(
            "INSERT INTO participants (ledger_id, participant_id, name, weight) VALUES (?, ?, ?, 1)",
            ledgerId,
            participantId,
            displayName
        );
        log.info("Added virtual participant {} ('{}') to ledger {}", participantId, displayName, ledgerId);
        return new Participant(ledgerId, participantId, displayName, BigDecimal.ONE);
    }

    /**
     * Changes the current weight used for future drafts.
     */
    @Transactional
    public Participant setWeight(long ledgerId, long participantId, BigDecimal weight) {
        if (weight == null || weight.signum() <= 0) {
            throw new IllegalArgumentException("Weight must be positive");
        }
        int updated = jdbcTemplate.update(
            "UPDATE participants SET weight = ? WHERE ledger_id = ? AND participant_id = ?",
            weight,
            ledgerId,
            participantId
        );
        if (updated == 0) {
            throw new IllegalArgumentException(
                String.format("Participant %d not found in ledger %d", participantId, ledgerId));
        }
        log.info("Participant {} in ledger {} weight set to {}", participantId, ledgerId, weight);
        return find(ledgerId, participantId)
            .orElseThrow(() -> new IllegalStateException("Participant vanished after update: " + participantId));
    }

    @Transactional(readOnly = true)
    public Optional<Participant> find(long ledgerId, long participantId) {
        return jdbcTemplate.query(
            "SELECT ledger_id, participant_id, name, weight FROM participants " +
            "WHERE ledger_id = ? AND participant_id = ?",
            PARTICIPANT_ROW_MAPPER,
            ledgerId,
            participantId
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<Participant> list(long ledgerId) {
        return jdbcTemplate.query(
            "SELECT ledger_id, participant_id, name, weight FROM participants " +
            "WHERE ledger_id = ? ORDER BY participant_id",
            PARTICIPANT_ROW_MAPPER,
            ledgerId
        );
    }

    /**
     * Shares for a new draft, taken from the participants' current weights,
     * in the order given.
     *
     * @throws InvalidExpenseException if a participant is not a member of the ledger
     */
    @Transactional(readOnly = true)
    public List<ParticipantShare> sharesFor(long ledgerId, Collection<Long> participantIds) {
        List<ParticipantShare> shares = new ArrayList<>(participantIds.size());
        for (Long participantId : participantIds) {
            Participant participant = find(ledgerId, participantId)
                .orElseThrow(() -> new InvalidExpenseException(
                    String.format("Participant %d is not a member of ledger %d", participantId, ledgerId)));
            shares.add(participant.currentShare());
        }
        return shares;
    }

    /**
     * @throws InvalidExpenseException naming the first id that is not a member of the ledger
     */
    @Transactional(readOnly = true)
    public void requireMembers(long ledgerId, Collection<Long> participantIds) {
        Set<Long> members = new HashSet<>(jdbcTemplate.queryForList(
            "SELECT participant_id FROM participants WHERE ledger_id = ?",
            Long.class,
            ledgerId
        ));
        for (Long participantId : participantIds) {
            if (!members.contains(participantId)) {
                throw new InvalidExpenseException(
                    String.format("Participant %d is not a member of ledger %d", participantId, ledgerId));
            }
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Participant name cannot be blank");
        }
        return name.strip();
    }
}
