package org.evalux.poker.service.poker.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.evalux.poker.service.poker.engine.EngineConfig;
import org.evalux.poker.service.poker.engine.HoldemRulesEngine;
import org.evalux.poker.service.poker.error.RestorationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class SnapshotCodecTest {

    final SnapshotCodec codec = new SnapshotCodec(new ObjectMapper());

    private static HoldemRulesEngine dealt() {
        HoldemRulesEngine e = new HoldemRulesEngine(new EngineConfig(List.of(500L, 700L, 900L), 5, 10, 0, 1), new Random(11));
        e.dealNewHand();
        e.checkOrCall();
        return e;
    }

    @Test
    void write_puisRead_memeEtatMoteur() {
        HoldemRulesEngine e = dealt();
        PersistedHandState state = new PersistedHandState(e.serialize(), List.of(7L, 8L, 9L), List.of());

        String json = codec.write(state);
        assertThat(json).contains("\"hand_player_order\":[7,8,9]").contains("\"ready_players\"");

        PersistedHandState back = codec.read(json);
        assertThat(back.getHandPlayerOrder()).containsExactly(7L, 8L, 9L);
        assertThat(back.getEngine()).isEqualTo(e.serialize());
        assertThat(HoldemRulesEngine.restore(back.getEngine(), new Random()).serialize()).isEqualTo(e.serialize());
    }

    @Test
    void read_ligneSansEtat() {
        assertThat(codec.read("{}")).isNull();
        assertThat(codec.read("")).isNull();
    }

    @Test
    void read_jsonCorrompu() {
        assertThatThrownBy(() -> codec.read("{\"engine\": [1, 2"))
                .isInstanceOf(RestorationException.class);
    }

    @Test
    void timeouts_allerRetour() {
        String json = codec.writeTimeouts(Map.of("42", 2));
        assertThat(codec.readTimeouts(json)).containsEntry("42", 2);
        assertThat(codec.readTimeouts("pas du json")).isEmpty();
        assertThat(codec.readTimeouts(null)).isEmpty();
    }
}
