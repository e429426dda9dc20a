package com.questrail.salvo.session.state;

/**
 * One of the two seats of a game session.
 *
 * <p>{@link #ONE} is the player who waited in the matchmaking queue,
 * {@link #TWO} the player whose arrival completed the pair. The protocol
 * refers to slots by {@link #number()}.</p>
 */
public enum Slot {
    ONE(1),
    TWO(2);

    private final int number;

    Slot(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public Slot other() {
        return this == ONE ? TWO : ONE;
    }

    /**
     * @throws IllegalArgumentException if {@code number} is not 1 or 2
     */
    public static Slot ofNumber(int number) {
        return switch (number) {
            case 1 -> ONE;
            case 2 -> TWO;
            default -> throw new IllegalArgumentException("slot number must be 1 or 2: " + number);
        };
    }

    public static boolean isValidNumber(int number) {
        return number == 1 || number == 2;
    }
}
