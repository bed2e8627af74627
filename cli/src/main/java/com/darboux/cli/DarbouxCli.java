package com.darboux.cli;

import com.darboux.exception.DarbouxException;
import com.darboux.functions.MathFunction;
import com.darboux.history.FunctionHistory;
import com.darboux.history.HistoryEntry;
import com.darboux.integration.IntegrationRequest;
import com.darboux.integration.Integrator;
import com.darboux.runtime.DarbouxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Console front end: prints the rules, then loops over the main menu until
 * the user picks anything other than a listed option.
 *
 * <p>Responsibilities:
 * <ol>
 *   <li>Collect the integrand and the interval bounds and save them to the history</li>
 *   <li>Re-run the last saved function</li>
 *   <li>List the history file</li>
 * </ol>
 *
 * <p>A rejected request prints its message and returns to the menu.
 */
public class DarbouxCli {
    private static final Logger logger = LoggerFactory.getLogger(DarbouxCli.class);

    private static final String RULE =
        "----------------------------------------------------------------------------------------------------------------";

    private final BufferedReader in;
    private final PrintStream out;
    private final Integrator integrator;
    private final FunctionHistory history;
    private final RefinementPrompt refinementPrompt;
    private final ConsoleResultReporter reporter;

    public DarbouxCli(BufferedReader in, PrintStream out, Integrator integrator, FunctionHistory history) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.integrator = Objects.requireNonNull(integrator, "integrator must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.refinementPrompt = new RefinementPrompt(in, out, integrator);
        this.reporter = new ConsoleResultReporter(out);
    }

    /**
     * Runs the menu loop until exit or end of input.
     *
     * @throws IOException if the console cannot be read
     */
    public void run() throws IOException {
        printRules();
        while (true) {
            printMenu();
            Optional<MenuOption> choice = MenuOption.fromInput(in.readLine());
            out.println();
            if (choice.isEmpty()) {
                logger.debug("Exiting menu loop");
                return;
            }
            switch (choice.get()) {
                case INTEGRATE:
                    integrateNew();
                    break;
                case INTEGRATE_LAST:
                    integrateLast();
                    break;
                case LIST_SAVED:
                    out.print(history.readAll());
                    break;
                default:
                    return;
            }
        }
    }

    private void integrateNew() throws IOException {
        String integrand = prompt("Enter the integrand in Reverse Polish Notation (e.g. x 2 ^ x sin +): ");
        String start = prompt("Enter the start of the interval: ");
        String end = prompt("Enter the end of the interval: ");
        if (integrand == null || start == null || end == null) {
            return;
        }

        HistoryEntry entry;
        try {
            entry = history.append(integrand, start, end);
        } catch (DarbouxException e) {
            report(e);
            return;
        }
        integrate(entry);
    }

    private void integrateLast() throws IOException {
        Optional<HistoryEntry> last;
        try {
            last = history.lastEntry();
        } catch (DarbouxException e) {
            report(e);
            return;
        }
        if (last.isEmpty()) {
            out.println("There is no saved function yet.");
            return;
        }
        out.println("Function to integrate: " + last.get().integrand());
        out.println("Interval: " + last.get().interval());
        integrate(last.get());
    }

    private void integrate(HistoryEntry entry) throws IOException {
        OptionalInt refinement = refinementPrompt.ask();
        if (refinement.isEmpty()) {
            return;
        }
        out.println();

        IntegrationRequest request = entry.toRequest(refinement.getAsInt());
        try {
            integrator.integrate(request, reporter);
        } catch (DarbouxException e) {
            report(e);
        }
    }

    private String prompt(String message) throws IOException {
        out.print(message);
        out.flush();
        return in.readLine();
    }

    private void report(DarbouxException e) {
        logger.debug(e.getTechnicalMessage());
        out.println("Error: " + e.getUserMessage());
    }

    private void printRules() {
        out.println("Welcome to my program of numerical integration!");
        out.println(RULE);
        out.println("| The rules of integrating:");
        out.println("| \t a. You have to use Reverse Polish Notation!");
        out.println("| \t b. Use x as the variable, decimal numbers, + - * / ^ and "
            + String.join(" ", MathFunction.names()) + ".");
        out.println("| \t c. You must enter the right amount of operators (otherwise: stack over-/underflow).");
        out.println("| \t d. You must enter spaces between all operands and operators.");
        out.println("| \t e. The entry for the integrand must not exceed "
            + integrator.config().maxIntegrandLength() + " characters.");
        out.println(RULE);
        out.println();
    }

    private void printMenu() {
        out.println();
        out.println("I can do the following tasks for you:");
        for (MenuOption option : MenuOption.values()) {
            out.println("\t " + option.number() + ". " + option.label());
        }
        out.println("\t Other: Exit");
        out.println();
        out.print("To execute a task, enter a number chosen from above: ");
        out.flush();
    }

    /**
     * Main entry point.
     *
     * Usage:
     * <pre>
     * java -jar darboux-cli.jar [historyFile]
     * </pre>
     *
     * Settings are read from {@code darboux.*} system properties; a history
     * file argument overrides {@code darboux.historyFile}.
     */
    public static void main(String[] args) {
        DarbouxConfig config = DarbouxConfig.fromSystemProperties();
        FunctionHistory history = new FunctionHistory(
            args.length > 0 ? Paths.get(args[0]) : config.historyFile());

        try (Integrator integrator = new Integrator(config)) {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new DarbouxCli(in, System.out, integrator, history).run();
        } catch (Exception e) {
            logger.error("Darboux CLI failed", e);
            System.exit(1);
        }
    }
}
