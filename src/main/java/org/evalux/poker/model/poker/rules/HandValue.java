package org.evalux.poker.model.poker.rules;

import org.evalux.poker.model.poker.Card;

import java.util.List;

/** Force d'une main de 5 cartes : catégorie puis départage. */
public record HandValue(HandRank rank, int[] tiebreak, List<Card> cards) implements Comparable<HandValue> {

    @Override
    public int compareTo(HandValue o) {
        int c = Integer.compare(rank.ordinal(), o.rank.ordinal());
        if (c != 0) return c;
        for (int i = 0; i < Math.min(tiebreak.length, o.tiebreak.length); i++) {
            c = Integer.compare(tiebreak[i], o.tiebreak[i]);
            if (c != 0) return c;
        }
        return 0;
    }
}
