package com.acme.pci.probe;

import java.util.List;

public record ApiCall(String service, String command, String description, List<String> args) {

    public ApiCall {
        if (service == null || service.isBlank()) throw new IllegalArgumentException("service is required");
        if (command == null || command.isBlank()) throw new IllegalArgumentException("command is required");
        args = args == null ? List.of() : List.copyOf(args);
        if (description == null || description.isBlank()) description = service + " " + command;
    }

    public static ApiCall of(String service, String command, String description, String... args) {
        return new ApiCall(service, command, description, List.of(args));
    }

    public String label() { return service + " " + command; }
}
