package org.evalux.poker.service.poker.runtime;

import org.evalux.poker.service.poker.error.PokerValidationException;

import java.util.Locale;

public enum ActionType {
    FOLD, CHECK, CALL, BET, RAISE, ALL_IN, READY;

    public static ActionType parse(String raw) {
        if (raw == null || raw.isBlank()) throw new PokerValidationException("Action manquante");
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new PokerValidationException("Action inconnue: " + raw);
        }
    }
}
