package com.darboux.cli;

import com.darboux.integration.IntegrationResult;
import com.darboux.integration.ResultConsumer;
import com.darboux.integration.SummationPass;
import com.darboux.integration.SummationTimingStats;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Prints an integration result to the console.
 *
 * <p>All values use six decimals and a locale-independent format. Non-finite
 * sums are printed as {@code NaN} or {@code Infinity}.
 */
public class ConsoleResultReporter implements ResultConsumer {

    private final PrintStream out;

    public ConsoleResultReporter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void accept(IntegrationResult result) {
        for (SummationPass pass : SummationPass.values()) {
            out.println(pass.label() + " = " + format(result.get(pass)));
        }
        out.println();

        out.println("Difference between Darboux-sums = " + format(result.darbouxDifference()));
        out.println("Average of the Darboux-sums = " + format(result.darbouxAverage()));
        out.println();

        out.println("Difference between Riemann-sum and average of the Darboux-sums = "
            + format(result.riemannDeviation()));
        out.println();

        SummationTimingStats timing = result.timing();
        for (SummationPass pass : SummationPass.values()) {
            out.println(String.format(Locale.ROOT, "Time of %s = %.3f ms",
                pass.label(), timing.getPassMillis(pass)));
        }
        out.println();
    }

    static String format(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
