package org.evalux.poker.model.poker;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/** Carte à jouer, sérialisée en code court ("Ah", "Td", "2c"). */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class Card {
    private final Rank rank;
    private final Suit suit;

    public int value() {
        return rank.ordinal() + 2; // TWO=2 ... ACE=14
    }

    public String code() {
        return "" + rank.symbol + suit.symbol;
    }

    @Override
    public String toString() { return code(); }

    public static Card parse(String code) {
        if (code == null || code.length() != 2) throw new IllegalArgumentException("Carte invalide: " + code);
        return new Card(Rank.of(code.charAt(0)), Suit.of(code.charAt(1)));
    }

    public static List<Card> parseAll(List<String> codes) {
        List<Card> out = new ArrayList<>();
        if (codes == null) return out;
        for (String c : codes) out.add(parse(c));
        return out;
    }

    public static List<String> codes(List<Card> cards) {
        List<String> out = new ArrayList<>(cards.size());
        for (Card c : cards) out.add(c.code());
        return out;
    }

    /** Jeu complet de 52 cartes, non mélangé. */
    public static List<Card> fullDeck() {
        List<Card> tmp = new ArrayList<>(52);
        for (Suit s : Suit.values()) {
            for (Rank r : Rank.values()) tmp.add(new Card(r, s));
        }
        return tmp;
    }

    public enum Suit {
        SPADES('s'), HEARTS('h'), DIAMONDS('d'), CLUBS('c');

        private final char symbol;
        Suit(char symbol) { this.symbol = symbol; }

        static Suit of(char c) {
            for (Suit s : values()) if (s.symbol == Character.toLowerCase(c)) return s;
            throw new IllegalArgumentException("Couleur invalide: " + c);
        }
    }

    public enum Rank {
        TWO('2'), THREE('3'), FOUR('4'), FIVE('5'), SIX('6'), SEVEN('7'), EIGHT('8'),
        NINE('9'), TEN('T'), JACK('J'), QUEEN('Q'), KING('K'), ACE('A');

        private final char symbol;
        Rank(char symbol) { this.symbol = symbol; }

        static Rank of(char c) {
            for (Rank r : values()) if (r.symbol == Character.toUpperCase(c)) return r;
            throw new IllegalArgumentException("Rang invalide: " + c);
        }
    }
}
