package org.evalux.poker.service.poker.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.evalux.poker.service.poker.engine.EngineSnapshot;

import java.util.ArrayList;
import java.util.List;

/** Document JSON écrit dans poker_hand.engine_snapshot. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PersistedHandState {
    private EngineSnapshot engine;

    // index moteur -> user id, figé pour toute la durée de la main
    @JsonProperty("hand_player_order")
    private List<Long> handPlayerOrder = new ArrayList<>();

    @JsonProperty("ready_players")
    private List<Long> readyPlayers = new ArrayList<>();
}
