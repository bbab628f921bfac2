package io.hookcron.core;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * The HTTP call a job performs.
 */
public record Target(String url, String method) {

    public static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    public Target {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(method, "method must not be null");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        method = method.trim().toUpperCase(Locale.ROOT);
        if (!ALLOWED_METHODS.contains(method)) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + method);
        }
    }
}
