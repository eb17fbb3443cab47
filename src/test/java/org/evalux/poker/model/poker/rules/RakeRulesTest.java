package org.evalux.poker.model.poker.rules;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RakeRulesTest {

    @Test
    void compute_cinqPourcentPlafonne() {
        assertThat(RakeRules.compute(1000, 500, 50)).isEqualTo(50);
        assertThat(RakeRules.compute(20, 500, 50)).isEqualTo(1);
    }

    @Test
    void compute_arrondiInferieur() {
        assertThat(RakeRules.compute(39, 500, 50)).isEqualTo(1);
        assertThat(RakeRules.compute(19, 500, 50)).isZero();
    }

    @Test
    void compute_sansPlafondQuandCapNul() {
        assertThat(RakeRules.compute(5000, 500, 0)).isEqualTo(250);
    }

    @Test
    void compute_tauxNulOuPotVide() {
        assertThat(RakeRules.compute(1000, 0, 50)).isZero();
        assertThat(RakeRules.compute(0, 500, 50)).isZero();
    }

    @Test
    void distribute_auProrata() {
        assertThat(RakeRules.distribute(List.of(600L, 400L), 50)).containsExactly(30L, 20L);
    }

    @Test
    void distribute_leDernierAbsorbeLeReste() {
        List<Long> shares = RakeRules.distribute(List.of(1L, 1L, 1L), 2);
        assertThat(shares).containsExactly(0L, 0L, 2L);
        assertThat(shares.stream().mapToLong(Long::longValue).sum()).isEqualTo(2);
    }

    @Test
    void distribute_sansRake() {
        assertThat(RakeRules.distribute(List.of(500L), 0)).containsExactly(0L);
        assertThat(RakeRules.distribute(List.of(), 10)).isEmpty();
    }
}
