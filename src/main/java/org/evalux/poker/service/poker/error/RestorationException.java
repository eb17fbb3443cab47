package org.evalux.poker.service.poker.error;

/** Snapshot corrompu ou incompatible. */
public class RestorationException extends RuntimeException {
    public RestorationException(String message) { super(message); }
    public RestorationException(String message, Throwable cause) { super(message, cause); }
}
