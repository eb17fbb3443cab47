package org.evalux.poker.model.poker.rules;

public enum HandRank {
    HIGH_CARD("high_card"),
    PAIR("pair"),
    TWO_PAIR("two_pair"),
    THREE_OF_A_KIND("three_of_a_kind"),
    STRAIGHT("straight"),
    FLUSH("flush"),
    FULL_HOUSE("full_house"),
    FOUR_OF_A_KIND("four_of_a_kind"),
    STRAIGHT_FLUSH("straight_flush");

    private final String label;

    HandRank(String label) { this.label = label; }

    public String label() { return label; }
}
