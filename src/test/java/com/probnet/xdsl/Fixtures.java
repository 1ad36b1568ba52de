package com.probnet.xdsl;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Access to the sample networks under {@code src/test/resources/networks}.
 */
public final class Fixtures {
    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/networks/" + name)) {
            if (in == null)
                throw new IllegalArgumentException("No fixture " + name);
            // every fixture is plain ASCII, whatever its declared encoding
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path path(String name) {
        URL url = Fixtures.class.getResource("/networks/" + name);
        if (url == null)
            throw new IllegalArgumentException("No fixture " + name);
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
