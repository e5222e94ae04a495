package com.reclaimradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only audit row written once per sync run. Never updated.
 */
@Document(collection = "sync_logs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SyncLog {

    public static final String TYPE_REIMBURSEMENT_FULL_SYNC = "REIMBURSEMENT_FULL_SYNC";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String syncType;
    /** Run start (wall clock), not the report window. */
    private Instant startDate;
    private Instant endDate;
    private Instant dataStartTime;
    private Instant dataEndTime;
    private SyncLogStatus status;
    private int recordsProcessed;
    private int recordsAdded;
    private int recordsUpdated;
    private String errorMessage;
    @Indexed
    private Instant completedAt;

    public enum SyncLogStatus {
        SUCCESS,
        PARTIAL_SUCCESS,
        FAILED
    }
}
