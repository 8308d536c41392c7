package de.unibi.cebitec.corpus.sync.util;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Scanner;

/**
 * Yes/no question on the console before large downloads.
 */
public class ConfirmationPrompt {

    private final Scanner scanner;
    private final PrintStream out;

    public ConfirmationPrompt(InputStream in, PrintStream out) {
        this.scanner = new Scanner(in, StandardCharsets.UTF_8.name());
        this.out = out;
    }

    /**
     * @return {@code true} only for an explicit "yes" or "y"; end of input counts as "no"
     */
    public boolean confirm(String question) {
        this.out.print(question + " (yes/no): ");
        this.out.flush();
        if (!this.scanner.hasNextLine()) {
            this.out.println();
            return false;
        }
        String answer = this.scanner.nextLine().trim().toLowerCase(Locale.ROOT);
        return answer.equals("yes") || answer.equals("y");
    }
}
