package org.evalux.poker.service.poker.error;

/** Action refusée (hors tour, illégale, solde insuffisant, pas de main active). Jamais rejouée en interne. */
public class PokerValidationException extends RuntimeException {
    public PokerValidationException(String message) { super(message); }
}
