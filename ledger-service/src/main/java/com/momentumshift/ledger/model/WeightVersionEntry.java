package com.momentumshift.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("weight_version_ledger")
public class WeightVersionEntry {

    @Id
    private Long id;

    private String version;
    private String parentVersion;
    private double w1;
    private double w2;
    private String reason;

    private LocalDateTime createdAt;
    private LocalDateTime recordedAt;
}
