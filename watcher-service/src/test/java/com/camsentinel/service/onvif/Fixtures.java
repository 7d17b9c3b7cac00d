package com.camsentinel.service.onvif;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

final class Fixtures {

    private Fixtures() {
    }

    static String load(String name) {
        try (InputStream is = Fixtures.class.getClassLoader().getResourceAsStream("onvif/" + name)) {
            if (is == null) {
                throw new IllegalArgumentException("Missing fixture: " + name);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
