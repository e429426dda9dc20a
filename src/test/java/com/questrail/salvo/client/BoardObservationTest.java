package com.questrail.salvo.client;

import com.questrail.salvo.protocol.model.ShotOutcome;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BoardObservationTest {

    @Test
    void recordedCellsAreNoLongerUnexplored() {
        BoardObservation empty = BoardObservation.empty(2);

        BoardObservation next = empty.record(new Cell(0, 1), ShotOutcome.MISS);

        assertEquals(4, empty.unexploredCells().size());
        assertEquals(List.of(new Cell(0, 0), new Cell(1, 0), new Cell(1, 1)), next.unexploredCells());
        assertEquals(ShotOutcome.MISS, next.outcomeAt(new Cell(0, 1)).orElseThrow());
        assertTrue(empty.outcomeAt(new Cell(0, 1)).isEmpty());
    }

    @Test
    void cellsOutsideTheBoardAreRejected() {
        BoardObservation board = BoardObservation.empty(10);

        assertThrows(IllegalArgumentException.class, () -> board.record(new Cell(10, 0), ShotOutcome.HIT));
        assertThrows(IllegalArgumentException.class, () -> new Cell(-1, 0));
    }
}
