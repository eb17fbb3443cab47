package org.evalux.poker.service.poker.error;

/** Levée par le moteur de règles ; le runtime la laisse remonter telle quelle. */
public class IllegalActionException extends PokerValidationException {
    public IllegalActionException(String message) { super(message); }
}
