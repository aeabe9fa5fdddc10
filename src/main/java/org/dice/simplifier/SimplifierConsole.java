package org.dice.simplifier;

import org.apache.commons.lang.StringUtils;
import org.dice.simplifier.parsing.ExpressionException;
import org.dice.simplifier.parsing.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Created by simon.hughes on 4/13/16.
 *
 * Text front end: type an expression to enter it, then {@code :step} to walk through
 * the simplification one law at a time or {@code :result} to see all of it.
 * An empty line or {@code exit} quits.
 */
public class SimplifierConsole {

    private static final Logger Log = LoggerFactory.getLogger( SimplifierConsole.class );

    static final String STEP = ":step";
    static final String RESULT = ":result";
    static final String HELP = ":help";
    static final String EXIT = "exit";

    private static final String PROMPT = "Please enter a boolean expression (" + HELP + " for commands):";

    private final BooleanSimplifier simplifier;
    private final PrintStream out;

    // expression entered last, already normalized
    private String expression = null;
    private List<SimplificationStep> steps = null;
    private int currentStep = 0;

    public SimplifierConsole(BooleanSimplifier simplifier, PrintStream out) {
        this.simplifier = simplifier;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8.name());
        SimplifierConsole console = new SimplifierConsole(new BooleanSimplifier(), out);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        out.println(PROMPT);
        String userInput = in.readLine();
        while (console.handle(userInput))
        {
            out.println();
            out.println(PROMPT);
            userInput = in.readLine();
        }
    }

    /**
     * Processes one line of input.
     *
     * @return false once the user asked to quit
     */
    public boolean handle(String line) {
        if (line == null || StringUtils.isBlank(line) || EXIT.equalsIgnoreCase(line.trim())) {
            return false;
        }

        String command = line.trim();
        try {
            if (STEP.equalsIgnoreCase(command)) {
                nextStep();
            }
            else if (RESULT.equalsIgnoreCase(command)) {
                showResult();
            }
            else if (HELP.equalsIgnoreCase(command)) {
                showHelp();
            }
            else {
                enter(line);
            }
        }
        catch (ExpressionException ex) {
            out.println("Syntax error: " + ex.getMessage());
        }
        catch (RuntimeException ex) {
            Log.error("Unexpected failure while processing '" + command + "'", ex);
            out.println("Error:\n" + ex.toString());
        }
        return true;
    }

    private void enter(String line) {
        String normalized;
        try {
            normalized = BooleanSimplifier.normalize(line);
        }
        catch (ValidationException ex) {
            // keep the previous expression
            out.println("Validation error: " + ex.getMessage());
            return;
        }
        this.expression = normalized;
        this.steps = null;
        this.currentStep = 0;
        out.println("Normalized: " + normalized);
    }

    private void nextStep() {
        if (StringUtils.isBlank(expression)) {
            out.println("Enter a valid expression first.");
            return;
        }
        if (steps == null) {
            steps = simplifier.simplify(expression).getSteps();
            currentStep = 0;
        }
        if (currentStep < steps.size()) {
            SimplificationStep step = steps.get(currentStep);
            out.println(String.format("Step %d:", currentStep + 1));
            out.println("  Before: " + step.getBefore());
            out.println("  Law:    " + step.getLaw().getLabel());
            out.println("  After:  " + step.getAfter());
            currentStep++;
        }
        else {
            out.println("No more steps.");
        }
    }

    private void showResult() {
        if (StringUtils.isBlank(expression)) {
            out.println("Enter a valid expression first.");
            return;
        }
        SimplificationResult result = simplifier.simplify(expression);
        out.println("Final result: " + result.getFinalText());
        out.println("Steps:");
        List<SimplificationStep> all = result.getSteps();
        for (int i = 0; i < all.size(); i++) {
            out.println(String.format("Step %d: %s", i + 1, all.get(i)));
        }
        if (result.isTruncated()) {
            out.println(String.format("Stopped after %d steps (%s)", all.size(), simplifier.getConfig()));
        }
    }

    private void showHelp() {
        out.println("  <expression>  enter an expression, e.g. (A and B) or (A and C)");
        out.println("  " + STEP + "         show the next simplification step");
        out.println("  " + RESULT + "       show the final result and every step");
        out.println("  " + EXIT + "          quit");
        out.println("Operators: & and * ∧ • ⋅ | or + ∨ ! not ~ ¬, constants 0 and 1");
    }
}
