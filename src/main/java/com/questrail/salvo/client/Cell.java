package com.questrail.salvo.client;

/**
 * A board coordinate, zero-based.
 */
public record Cell(int row, int col) {
    public Cell {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Cell coordinates must be non-negative: " + row + "," + col);
        }
    }
}
