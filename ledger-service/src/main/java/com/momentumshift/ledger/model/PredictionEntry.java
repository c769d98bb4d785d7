package com.momentumshift.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One prediction-record row. A prediction is appended once as PREDICTED and at most
 * once more as EVALUATED; the PREDICTED row is never rewritten.
 */
@Data
@NoArgsConstructor
@Table("prediction_ledger")
public class PredictionEntry {

    @Id
    private Long id;

    private String runId;
    private String momentId;
    private String playerId;
    private String weightVersion;
    private String modelVersion;
    private String status;

    private double score;
    private Double meanAbsoluteError;

    /** JSON-serialised {@code PredictionRecord} */
    private String payload;

    private LocalDateTime recordedAt;
}
