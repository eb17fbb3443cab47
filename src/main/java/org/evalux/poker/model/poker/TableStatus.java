package org.evalux.poker.model.poker;

public enum TableStatus { WAITING, ACTIVE, PAUSED, ENDED, EXPIRED }
