package com.starscape.gallery.features.repositories.app;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * GitHub repository name rules, checked before a name is used in an API path or cache key.
 */
public final class RepositoryNames {

    static final int MAX_LENGTH = 100;

    private static final List<String> INVALID_SEQUENCES = List.of("..", "~", "^", ":", "\\", "/", "?", "*", "[", "]");

    private static final Set<String> RESERVED = Set.of(
        "con", "prn", "aux", "nul",
        "com1", "com2", "com3", "com4", "com5", "com6", "com7", "com8", "com9",
        "lpt1", "lpt2", "lpt3", "lpt4", "lpt5", "lpt6", "lpt7", "lpt8", "lpt9"
    );

    private RepositoryNames() {
    }

    /**
     * @return the trimmed name
     * @throws IllegalArgumentException if the name breaks a naming rule
     */
    public static String validate(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Repository name cannot be empty");
        }
        String trimmed = name.strip();
        if (trimmed.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Repository name must be less than " + MAX_LENGTH + " characters");
        }
        if (!Character.isLetterOrDigit(trimmed.charAt(0))) {
            throw new IllegalArgumentException("Repository name must start with a letter or number");
        }
        for (String sequence : INVALID_SEQUENCES) {
            if (trimmed.contains(sequence)) {
                throw new IllegalArgumentException("Repository name cannot contain '" + sequence + "'");
            }
        }
        if (RESERVED.contains(trimmed.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("'" + trimmed + "' is a reserved name");
        }
        return trimmed;
    }
}
