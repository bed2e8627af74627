package com.darboux.cli;

import com.darboux.exception.ValidationException;
import com.darboux.integration.Integrator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.OptionalInt;

/**
 * Asks for the number of subintervals of the partition.
 *
 * <p>The answer must be a whole number inside the configured range. Out of
 * range values are rejected, not clamped.
 */
class RefinementPrompt {

    private final BufferedReader in;
    private final PrintStream out;
    private final Integrator integrator;

    RefinementPrompt(BufferedReader in, PrintStream out, Integrator integrator) {
        this.in = in;
        this.out = out;
        this.integrator = integrator;
    }

    /**
     * Prompts once.
     *
     * @return the refinement, or empty if the answer was rejected
     * @throws IOException if the console cannot be read
     */
    OptionalInt ask() throws IOException {
        int min = integrator.config().minRefinement();
        int max = integrator.config().maxRefinement();
        out.print("Enter the scale of refinement (x in [" + min + " ; " + max + "]): ");
        out.flush();

        String line = in.readLine();
        if (line == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(integrator.validateRefinement(Integer.parseInt(line.strip())));
        } catch (NumberFormatException e) {
            out.println("Error: The scale of refinement must be a whole number.");
        } catch (ValidationException e) {
            out.println("Error: " + e.getMessage() + ".");
        }
        return OptionalInt.empty();
    }
}
