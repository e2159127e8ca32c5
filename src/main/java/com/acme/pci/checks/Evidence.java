package com.acme.pci.checks;

public record Evidence<T>(T fact, String reason) {

    public static <T> Evidence<T> of(T fact) { return new Evidence<>(fact, null); }
    public static <T> Evidence<T> incomplete(String reason) { return new Evidence<>(null, reason); }

    public boolean isComplete() { return fact != null; }
}
