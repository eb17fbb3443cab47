package org.evalux.poker.service.poker.engine;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

/** Fabrique par défaut : moteur hold'em maison, mélange {@link SecureRandom}. */
@Component
public class HoldemRulesEngineFactory implements RulesEngineFactory {
    private final Random rnd = new SecureRandom();

    @Override
    public RulesEngine create(EngineConfig config) {
        return new HoldemRulesEngine(config, rnd);
    }

    @Override
    public RulesEngine restore(EngineSnapshot snapshot) {
        return HoldemRulesEngine.restore(snapshot, rnd);
    }
}
