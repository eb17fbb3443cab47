package org.evalux.poker.service.poker.runtime;

import org.evalux.poker.model.poker.PokerTable;
import org.evalux.poker.model.poker.TableStatus;

public record TableSettings(Long tableId, String name, TableStatus status,
                            long smallBlind, long bigBlind, long ante,
                            int rakeBasisPoints, long rakeCap, int turnTimeoutSeconds) {

    public static TableSettings of(PokerTable t) {
        return new TableSettings(t.getId(), t.getName(), t.getStatus(), t.getSmallBlind(), t.getBigBlind(), t.getAnte(),
                t.getRakeBasisPoints(), t.getRakeCap(), t.getTurnTimeoutSeconds());
    }
}
