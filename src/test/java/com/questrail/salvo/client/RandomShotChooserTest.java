package com.questrail.salvo.client;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class RandomShotChooserTest {

    @Test
    void alwaysChoosesALegalCell() {
        RandomShotChooser chooser = new RandomShotChooser(new Random(42));
        BoardObservation board = BoardObservation.empty(10);
        List<Cell> legal = List.of(new Cell(0, 0), new Cell(4, 7), new Cell(9, 9));

        for (int i = 0; i < 200; i++) {
            assertTrue(legal.contains(chooser.chooseShot(board, legal)));
        }
    }

    @Test
    void sameSeedSameChoices() {
        BoardObservation board = BoardObservation.empty(10);
        List<Cell> legal = board.unexploredCells();
        RandomShotChooser a = new RandomShotChooser(new Random(7));
        RandomShotChooser b = new RandomShotChooser(new Random(7));

        for (int i = 0; i < 20; i++) {
            assertEquals(a.chooseShot(board, legal), b.chooseShot(board, legal));
        }
    }

    @Test
    void noLegalCellsIsAnError() {
        RandomShotChooser chooser = new RandomShotChooser(new Random());

        assertThrows(IllegalArgumentException.class,
                () -> chooser.chooseShot(BoardObservation.empty(3), List.of()));
    }
}
