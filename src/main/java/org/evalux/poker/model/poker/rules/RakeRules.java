package org.evalux.poker.model.poker.rules;

import java.util.ArrayList;
import java.util.List;

public final class RakeRules {
    private RakeRules(){}

    public static final int BASIS_POINTS = 10_000;

    /** rake = min(floor(pot * bps / 10000), cap). Un plafond <= 0 signifie "sans plafond". */
    public static long compute(long pot, int rateBasisPoints, long cap) {
        if (pot <= 0 || rateBasisPoints <= 0) return 0L;
        long raw = Math.multiplyExact(pot, (long) rateBasisPoints) / BASIS_POINTS;
        return cap > 0 ? Math.min(raw, cap) : raw;
    }

    /**
     * Répartit le rake entre les gagnants au prorata de leurs gains.
     * Le dernier gagnant absorbe le reste d'arrondi : la somme des retenues vaut exactement {@code rake}.
     */
    public static List<Long> distribute(List<Long> winnings, long rake) {
        List<Long> out = new ArrayList<>(winnings.size());
        if (winnings.isEmpty()) return out;
        long total = winnings.stream().mapToLong(Long::longValue).sum();
        if (rake <= 0 || total <= 0) {
            for (int i = 0; i < winnings.size(); i++) out.add(0L);
            return out;
        }
        long assigned = 0;
        for (int i = 0; i < winnings.size() - 1; i++) {
            long share = Math.multiplyExact(rake, winnings.get(i)) / total;
            out.add(share);
            assigned += share;
        }
        out.add(rake - assigned);
        return out;
    }
}
