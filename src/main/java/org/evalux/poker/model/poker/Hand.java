package org.evalux.poker.model.poker;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "poker_hand",
        indexes = @Index(name = "idx_hand_table_hand_no", columnList = "table_id, hand_no"),
        uniqueConstraints = @UniqueConstraint(name = "uk_hand_table_hand_no", columnNames = {"table_id", "hand_no"}))
@Data
public class Hand {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "hand_no", nullable = false)
    private int handNo;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private HandStatus status = HandStatus.PREFLOP;

    // état moteur complet + hand_player_order, en JSON opaque
    @Column(name = "engine_snapshot", nullable = false, length = 65535)
    private String engineSnapshot = "{}";

    @Column(name = "pot_size", nullable = false)
    private long potSize = 0;

    @Column(name = "rake_amount", nullable = false)
    private long rakeAmount = 0;

    // {"<userId>": nb de timeouts consécutifs}
    @Column(name = "timeout_tracking", length = 2048)
    private String timeoutTracking = "{}";

    @Column(name = "action_deadline")
    private Instant actionDeadline;

    @Column(name = "inter_hand_deadline")
    private Instant interHandDeadline;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @PrePersist
    public void prePersist() {
        if (startedAt == null) startedAt = Instant.now();
    }
}
