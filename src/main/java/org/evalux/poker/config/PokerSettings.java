package org.evalux.poker.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Getter
@Component
public class PokerSettings {

    // délai entre la fin d'une main et le lancement forcé de la suivante
    @Value("${poker.post-hand-delay-seconds:20}")
    private int postHandDelaySeconds = 20;

    @Value("${poker.table-inactivity-timeout-minutes:10}")
    private int tableInactivityTimeoutMinutes = 10;

    // au-delà, le joueur est mis "sitting out" pour la main suivante
    @Value("${poker.max-consecutive-timeouts:2}")
    private int maxConsecutiveTimeouts = 2;

    public PokerSettings() {}

    public PokerSettings(int postHandDelaySeconds, int tableInactivityTimeoutMinutes, int maxConsecutiveTimeouts) {
        this.postHandDelaySeconds = postHandDelaySeconds;
        this.tableInactivityTimeoutMinutes = tableInactivityTimeoutMinutes;
        this.maxConsecutiveTimeouts = maxConsecutiveTimeouts;
    }
}
