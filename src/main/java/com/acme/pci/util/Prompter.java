package com.acme.pci.util;

public interface Prompter {

    // Returns the operator's answer, or defaultValue when the answer is blank.
    String ask(String question, String defaultValue);

    // Yes/no question where an empty answer means no.
    boolean confirm(String question);
}
