package io.trello.util;

import org.jspecify.annotations.Nullable;

public final class Assert {

    private Assert() {
    }

    /**
     * Checks that a parameter is not null.
     *
     * @param name the parameter name, used in the exception message
     * @param value the value to check
     * @param <T> the value type
     * @return the value
     * @throws IllegalArgumentException if the value is null
     */
    public static <T> T checkNotNullParam(String name, @Nullable T value) {
        if (value == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be null");
        }
        return value;
    }

    /**
     * Checks that a string parameter is neither null nor blank.
     *
     * @param name the parameter name, used in the exception message
     * @param value the value to check
     * @return the value
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static String checkNotBlankParam(String name, @Nullable String value) {
        checkNotNullParam(name, value);
        if (value.isBlank()) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be blank");
        }
        return value;
    }
}
