package com.acme.pci.render;

import java.time.format.DateTimeFormatter;

final class Formats {
    private Formats() {}

    static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
}
