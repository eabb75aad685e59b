package com.starscope.signals.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted detection result.
 *
 * Column mapping (R2DBC snake_case convention):
 *   signalType     → signal_type     (EarlySignalKind key, e.g. rising_star)
 *   severity       → severity        (low / medium / high)
 *   velocityValue  → velocity_value
 *   starCount      → star_count
 *   percentileRank → percentile_rank
 *   expiresAt      → expires_at
 *   acknowledgedAt → acknowledged_at
 *
 * Active = not acknowledged and {@code expiresAt} in the future. Rows are never
 * revived: acknowledgement is permanent and re-detection inserts a new row.
 */
@Data
@NoArgsConstructor
@Table("early_signals")
public class EarlySignal {

    @Id
    private Long id;

    private Long repoId;

    private String signalType;

    private String severity;

    private String description;

    private Double velocityValue;

    private Long starCount;

    private Double percentileRank;

    private LocalDateTime detectedAt;

    private LocalDateTime expiresAt;

    private boolean acknowledged;

    private LocalDateTime acknowledgedAt;
}
