package com.questrail.salvo.session;

/**
 * Registration failed because another live player already uses the name.
 */
public final class NameTakenException extends RuntimeException
{
    private final String name;

    public NameTakenException(String name) {
        super("Name already taken: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
