package com.acme.pci.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class ConsolePrompter implements Prompter {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompter() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsolePrompter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public String ask(String question, String defaultValue) {
        out.print(question + ": ");
        out.flush();
        String line = readLine();
        if (line == null || line.isBlank()) return defaultValue;
        return line.trim();
    }

    @Override
    public boolean confirm(String question) {
        while (true) {
            out.print(question + " [y/N]: ");
            out.flush();
            String line = readLine();
            Boolean answer = parseYesNo(line);
            if (answer != null) return answer;
            out.println("Please answer yes (y) or no (n)");
        }
    }

    // null means the answer was not understood; end of input counts as no.
    static Boolean parseYesNo(String line) {
        if (line == null) return Boolean.FALSE;
        return switch (line.trim().toLowerCase(Locale.ROOT)) {
            case "y", "yes" -> Boolean.TRUE;
            case "", "n", "no" -> Boolean.FALSE;
            default -> null;
        };
    }

    private String readLine() {
        try { return in.readLine(); }
        catch (IOException e) { throw new UncheckedIOException("Cannot read operator input", e); }
    }
}
