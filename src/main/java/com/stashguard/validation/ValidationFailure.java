package com.stashguard.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * A single rejected rule, with the chain of locations leading to the offending item.
 *
 * @param code failure category
 * @param path outermost-first location labels, for example {@code ["Item 3", "Contents[1]"]}
 * @param reason what was wrong at that location
 */
public record ValidationFailure(FailureCode code, List<String> path, String reason) {

    public ValidationFailure {
        path = List.copyOf(path);
    }

    public static ValidationFailure of(FailureCode code, String reason) {
        return new ValidationFailure(code, List.of(), reason);
    }

    /**
     * Returns a copy of this failure nested one level deeper under {@code segment}.
     */
    public ValidationFailure within(String segment) {
        List<String> nested = new ArrayList<>(path.size() + 1);
        nested.add(segment);
        nested.addAll(path);
        return new ValidationFailure(code, nested, reason);
    }

    /**
     * @return the human-readable reason chain, e.g. {@code Item 3: Contents[1]: Invalid stack size}
     */
    public String message() {
        if (path.isEmpty()) {
            return reason;
        }
        return String.join(": ", path) + ": " + reason;
    }

    @Override
    public String toString() {
        return code + " " + message();
    }
}
