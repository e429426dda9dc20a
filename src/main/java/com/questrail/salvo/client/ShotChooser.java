package com.questrail.salvo.client;

import java.util.List;

/**
 * Decision function of an automated player.
 *
 * <p>Implementations are driven by a client; the server never consults one.</p>
 */
@FunctionalInterface
public interface ShotChooser
{
    /**
     * @param observation what is known about the opponent's board
     * @param legalCells  the cells that may be fired at; never empty
     * @return one element of {@code legalCells}
     */
    Cell chooseShot(BoardObservation observation, List<Cell> legalCells);
}
