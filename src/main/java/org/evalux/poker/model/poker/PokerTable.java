package org.evalux.poker.model.poker;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "poker_table")
@Data
public class PokerTable {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", length = 40)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TableStatus status = TableStatus.WAITING;

    // --- configuration ---
    @Column(name = "small_blind", nullable = false)
    private long smallBlind = 25;

    @Column(name = "big_blind", nullable = false)
    private long bigBlind = 50;

    @Column(name = "ante", nullable = false)
    private long ante = 0;

    @Column(name = "starting_stack", nullable = false)
    private long startingStack = 1000;

    @Column(name = "max_players", nullable = false)
    private int maxPlayers = 8;

    // commission en points de base (500 = 5 %)
    @Column(name = "rake_basis_points", nullable = false)
    private int rakeBasisPoints = 0;

    @Column(name = "rake_cap", nullable = false)
    private long rakeCap = 0;

    @Column(name = "turn_timeout_seconds", nullable = false)
    private int turnTimeoutSeconds = 25;

    @Column(name = "last_action_at")
    private Instant lastActionAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
