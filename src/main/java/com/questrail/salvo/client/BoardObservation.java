package com.questrail.salvo.client;

import com.questrail.salvo.protocol.model.ShotOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a player knows about the opponent's board: the outcome of every shot
 * fired so far. Immutable; {@link #record(Cell, ShotOutcome)} returns a new
 * observation.
 */
public final class BoardObservation
{
    private final int size;
    private final Map<Cell, ShotOutcome> outcomes;

    private BoardObservation(int size, Map<Cell, ShotOutcome> outcomes) {
        this.size = size;
        this.outcomes = Collections.unmodifiableMap(outcomes);
    }

    public static BoardObservation empty(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        return new BoardObservation(size, new LinkedHashMap<>());
    }

    public int size() {
        return size;
    }

    public boolean contains(Cell cell) {
        return cell.row() < size && cell.col() < size;
    }

    public Optional<ShotOutcome> outcomeAt(Cell cell) {
        return Optional.ofNullable(outcomes.get(cell));
    }

    /**
     * Outcomes in the order the shots were recorded.
     */
    public Map<Cell, ShotOutcome> outcomes() {
        return outcomes;
    }

    public BoardObservation record(Cell cell, ShotOutcome outcome) {
        Objects.requireNonNull(cell, "cell");
        Objects.requireNonNull(outcome, "outcome");
        if (!contains(cell)) {
            throw new IllegalArgumentException(cell + " is outside a " + size + "x" + size + " board");
        }
        Map<Cell, ShotOutcome> next = new LinkedHashMap<>(outcomes);
        next.put(cell, outcome);
        return new BoardObservation(size, next);
    }

    /**
     * Cells not yet fired at, row-major.
     */
    public List<Cell> unexploredCells() {
        List<Cell> cells = new ArrayList<>(size * size - outcomes.size());
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                Cell cell = new Cell(r, c);
                if (!outcomes.containsKey(cell)) {
                    cells.add(cell);
                }
            }
        }
        return cells;
    }
}
