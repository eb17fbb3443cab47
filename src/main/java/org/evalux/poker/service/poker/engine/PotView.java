package org.evalux.poker.service.poker.engine;

import java.util.List;

public record PotView(long amount, List<Integer> playerIndices) {
}
