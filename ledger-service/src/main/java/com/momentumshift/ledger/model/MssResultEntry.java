package com.momentumshift.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One issued MSS result. Unique per (runId, momentId, playerId, weightVersion);
 * rows are never updated.
 *
 * payload: JSON-serialised {@code MssResult}, the authoritative copy
 */
@Data
@NoArgsConstructor
@Table("mss_result_ledger")
public class MssResultEntry {

    @Id
    private Long id;

    private String runId;
    private String momentId;
    private String playerId;
    private String role;
    private String side;
    private String weightVersion;

    private double statisticalComponent;
    private double narrativeComponent;
    private double contextMultiplier;
    private double baseline;
    private double score;

    /** JSON-serialised {@code MssResult} */
    private String payload;

    private LocalDateTime recordedAt;
}
