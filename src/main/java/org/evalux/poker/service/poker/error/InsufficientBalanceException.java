package org.evalux.poker.service.poker.error;

import lombok.Getter;

@Getter
public class InsufficientBalanceException extends PokerValidationException {
    private final long required;
    private final long available;

    public InsufficientBalanceException(long required, long available) {
        super("Solde insuffisant pour la prochaine main (requis " + required + ", disponible " + available + ")");
        this.required = required;
        this.available = available;
    }
}
