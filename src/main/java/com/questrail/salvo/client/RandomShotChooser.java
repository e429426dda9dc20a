package com.questrail.salvo.client;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Picks a legal cell uniformly at random.
 */
public final class RandomShotChooser implements ShotChooser
{
    private final Random random;

    public RandomShotChooser(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Cell chooseShot(BoardObservation observation, List<Cell> legalCells) {
        Objects.requireNonNull(observation, "observation");
        if (legalCells == null || legalCells.isEmpty()) {
            throw new IllegalArgumentException("No legal cells to choose from");
        }
        return legalCells.get(random.nextInt(legalCells.size()));
    }
}
