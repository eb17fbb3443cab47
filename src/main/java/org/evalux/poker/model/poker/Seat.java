package org.evalux.poker.model.poker;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "poker_seat", indexes = @Index(name = "idx_seat_table", columnList = "table_id"))
@Data
public class Seat {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "display_name", length = 40)
    private String displayName;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "chips", nullable = false)
    private long chips;

    @Column(name = "joined_at")
    private Instant joinedAt;

    // null => siège actif
    @Column(name = "left_at")
    private Instant leftAt;

    @Column(name = "sitting_out_next_hand", nullable = false)
    private boolean sittingOutNextHand = false;

    public boolean isActive() { return leftAt == null; }

    @PrePersist
    public void prePersist() {
        if (joinedAt == null) joinedAt = Instant.now();
    }
}
