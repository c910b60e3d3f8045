package io.github.clickin.contrast.core;

/**
 * The three sRGB channels, in hex string order.
 */
public enum Channel {
    RED("red"),
    GREEN("green"),
    BLUE("blue");

    private final String label;

    Channel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
