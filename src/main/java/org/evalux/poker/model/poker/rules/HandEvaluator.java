package org.evalux.poker.model.poker.rules;

import org.evalux.poker.model.poker.Card;

import java.util.*;

public final class HandEvaluator {
    private HandEvaluator(){}

    /** Meilleure main de 5 cartes parmi 5 à 7 cartes (trous + tableau). */
    public static HandValue best(List<Card> cards) {
        if (cards.size() < 5) throw new IllegalArgumentException("Il faut au moins 5 cartes");
        HandValue best = null;
        int n = cards.size();
        for (int a = 0; a < n; a++)
            for (int b = a + 1; b < n; b++)
                for (int c = b + 1; c < n; c++)
                    for (int d = c + 1; d < n; d++)
                        for (int e = d + 1; e < n; e++) {
                            HandValue v = evaluate5(List.of(cards.get(a), cards.get(b), cards.get(c), cards.get(d), cards.get(e)));
                            if (best == null || v.compareTo(best) > 0) best = v;
                        }
        return best;
    }

    public static HandValue evaluate5(List<Card> five) {
        List<Card> sorted = new ArrayList<>(five);
        sorted.sort(Comparator.comparingInt(Card::value).reversed());

        boolean flush = sorted.stream().map(Card::getSuit).distinct().count() == 1;
        int straightHigh = straightHigh(sorted);

        // groupes (valeur -> nombre), triés par nombre puis valeur
        Map<Integer, Integer> counts = new HashMap<>();
        for (Card c : sorted) counts.merge(c.value(), 1, Integer::sum);
        List<Map.Entry<Integer, Integer>> groups = new ArrayList<>(counts.entrySet());
        groups.sort((x, y) -> {
            int byCount = Integer.compare(y.getValue(), x.getValue());
            return byCount != 0 ? byCount : Integer.compare(y.getKey(), x.getKey());
        });
        int[] groupValues = groups.stream().mapToInt(Map.Entry::getKey).toArray();
        int[] kickers = sorted.stream().mapToInt(Card::value).toArray();

        if (flush && straightHigh > 0) return new HandValue(HandRank.STRAIGHT_FLUSH, new int[]{straightHigh}, sorted);
        int top = groups.get(0).getValue();
        if (top == 4) return new HandValue(HandRank.FOUR_OF_A_KIND, groupValues, sorted);
        if (top == 3 && groups.get(1).getValue() == 2) return new HandValue(HandRank.FULL_HOUSE, groupValues, sorted);
        if (flush) return new HandValue(HandRank.FLUSH, kickers, sorted);
        if (straightHigh > 0) return new HandValue(HandRank.STRAIGHT, new int[]{straightHigh}, sorted);
        if (top == 3) return new HandValue(HandRank.THREE_OF_A_KIND, groupValues, sorted);
        if (top == 2 && groups.get(1).getValue() == 2) return new HandValue(HandRank.TWO_PAIR, groupValues, sorted);
        if (top == 2) return new HandValue(HandRank.PAIR, groupValues, sorted);
        return new HandValue(HandRank.HIGH_CARD, kickers, sorted);
    }

    // 0 si pas de quinte ; la roue A-2-3-4-5 vaut 5
    private static int straightHigh(List<Card> sortedDesc) {
        TreeSet<Integer> values = new TreeSet<>(Comparator.reverseOrder());
        for (Card c : sortedDesc) values.add(c.value());
        if (values.size() != 5) return 0;
        int hi = values.first(), lo = values.last();
        if (hi - lo == 4) return hi;
        if (values.equals(new TreeSet<>(Set.of(14, 5, 4, 3, 2)))) return 5;
        return 0;
    }
}
