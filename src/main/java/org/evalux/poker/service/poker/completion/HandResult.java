package org.evalux.poker.service.poker.completion;

import java.util.List;
import java.util.Map;

/**
 * Résultat réglé d'une main, rake déjà retenu.
 *
 * @param finalStacks tapis de fin de main par user id
 * @param winners     gains nets par gagnant
 */
public record HandResult(Long tableId, Long handId, int handNo, long pot, long rake,
                         List<Long> participants, Map<Long, Long> finalStacks, List<SettledWinner> winners) {

    public record SettledWinner(Long userId, long amount, String handRank, List<String> bestHandCards) {
    }
}
