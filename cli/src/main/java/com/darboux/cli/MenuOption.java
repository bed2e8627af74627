package com.darboux.cli;

import java.util.Optional;

/**
 * Entries of the main menu. Any other choice ends the program.
 */
public enum MenuOption {
    INTEGRATE(1, "Numerical integration"),
    INTEGRATE_LAST(2, "Integrate the last saved function"),
    LIST_SAVED(3, "List the functions that have been saved");

    private final int number;
    private final String label;

    MenuOption(int number, String label) {
        this.number = number;
        this.label = label;
    }

    public int number() {
        return number;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a menu choice as typed by the user.
     *
     * @param input the typed line (may be null at end of input)
     * @return the option, or empty for "exit"
     */
    public static Optional<MenuOption> fromInput(String input) {
        if (input == null) {
            return Optional.empty();
        }
        int choice;
        try {
            choice = Integer.parseInt(input.strip());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        for (MenuOption option : values()) {
            if (option.number == choice) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
