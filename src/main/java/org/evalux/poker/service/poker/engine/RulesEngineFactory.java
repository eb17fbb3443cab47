package org.evalux.poker.service.poker.engine;

public interface RulesEngineFactory {

    RulesEngine create(EngineConfig config);

    /** @throws org.evalux.poker.service.poker.error.RestorationException si le snapshot est inexploitable */
    RulesEngine restore(EngineSnapshot snapshot);
}
