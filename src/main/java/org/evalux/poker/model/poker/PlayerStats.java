package org.evalux.poker.model.poker;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "player_stats")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerStats {
    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "hands_played", nullable = false)
    private int handsPlayed;

    @Column(name = "hands_won", nullable = false)
    private int handsWon;

    @Column(name = "total_winnings", nullable = false)
    private long totalWinnings;

    @Column(name = "best_hand_rank", length = 32)
    private String bestHandRank;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
