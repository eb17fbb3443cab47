package org.evalux.poker.service.poker.engine;

import java.util.List;

/**
 * Moteur de règles d'une main de hold'em no-limit.
 * Les actions s'appliquent toujours au joueur dont c'est le tour ; une action illégale lève
 * {@link org.evalux.poker.service.poker.error.IllegalActionException} sans modifier l'état.
 */
public interface RulesEngine {

    /** Mélange, poste antes et blindes, distribue les cartes privatives. */
    void dealNewHand();

    /** Distribue la rue suivante (flop 3, turn 1, river 1). Exige qu'aucun joueur n'ait à parler. */
    void dealNextStreet();

    void fold();

    void checkOrCall();

    /** Mise ou relance jusqu'à {@code amount} (total de la rue) ; plafonnée au tapis du joueur. */
    void betOrRaiseTo(long amount);

    boolean isHandComplete();

    boolean hasPendingActor();

    Integer actorIndex();

    LegalActions legalActions(int playerIndex);

    /** Gagnants triés par montant décroissant ; vide tant que la main n'est pas terminée. */
    List<WinnerInfo> winners();

    EngineView view();

    EngineSnapshot serialize();
}
