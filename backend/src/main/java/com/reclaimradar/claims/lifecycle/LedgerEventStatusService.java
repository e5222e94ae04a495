package com.reclaimradar.claims.lifecycle;

import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.LedgerEventRepository;
import com.reclaimradar.domain.LedgerEventStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

import static com.reclaimradar.claims.lifecycle.LedgerEventStatusException.EVENT_NOT_FOUND;
import static com.reclaimradar.claims.lifecycle.LedgerEventStatusException.INVALID_STATUS;

/**
 * Operator override of a ledger event's status. Any of the seven statuses may be set; operator statuses stick
 * across re-ingest and are ignored by the refresher.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerEventStatusService {

    private final LedgerEventRepository ledgerEventRepository;

    public LedgerEvent updateStatus(String id, String newStatus, String note) {
        LedgerEventStatus status = parse(newStatus)
                .orElseThrow(() -> new LedgerEventStatusException(INVALID_STATUS, "Invalid ledger event status: " + newStatus));
        LedgerEvent event = ledgerEventRepository.findById(id)
                .orElseThrow(() -> new LedgerEventStatusException(EVENT_NOT_FOUND, "Ledger event not found: " + id));
        LedgerEventStatus previous = event.getStatus();
        event.setStatus(status);
        if (note != null) {
            event.setStatusNote(note);
        }
        event.setUpdatedAt(Instant.now());
        LedgerEvent saved = ledgerEventRepository.save(event);
        log.info("Ledger event {} status {} -> {}", id, previous, status);
        return saved;
    }

    public LedgerEvent getEvent(String id) {
        return ledgerEventRepository.findById(id)
                .orElseThrow(() -> new LedgerEventStatusException(EVENT_NOT_FOUND, "Ledger event not found: " + id));
    }

    static Optional<LedgerEventStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.strip();
        return Arrays.stream(LedgerEventStatus.values()).filter(s -> s.name().equals(normalized)).findFirst();
    }
}
