package org.evalux.poker.service.poker.error;

/** Échec du commit : la transaction et l'état mémoire ont été ramenés avant l'action. */
public class PersistenceFailureException extends RuntimeException {
    public PersistenceFailureException(String message, Throwable cause) { super(message, cause); }
}
