package com.stashguard.persistence;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;

import java.time.Instant;
import java.util.Objects;

/**
 * A field assignment inside a write: a literal value, a numeric increment applied to the
 * stored value, or the commit's server timestamp.
 */
public final class FieldValue {

    private enum Kind { LITERAL, INCREMENT, SERVER_TIMESTAMP }

    private static final FieldValue SERVER_TIMESTAMP = new FieldValue(Kind.SERVER_TIMESTAMP, null, 0);

    private final Kind kind;
    private final JsonElement literal;
    private final long delta;

    private FieldValue(Kind kind, JsonElement literal, long delta) {
        this.kind = kind;
        this.literal = literal;
        this.delta = delta;
    }

    public static FieldValue of(JsonElement value) {
        return new FieldValue(Kind.LITERAL, value == null ? JsonNull.INSTANCE : value.deepCopy(), 0);
    }

    public static FieldValue of(String value) {
        return of(new JsonPrimitive(value));
    }

    public static FieldValue of(Number value) {
        return of(new JsonPrimitive(value));
    }

    /**
     * Adds {@code delta} to the stored number, treating a missing or non-numeric field as zero.
     */
    public static FieldValue increment(long delta) {
        return new FieldValue(Kind.INCREMENT, null, delta);
    }

    /**
     * Resolves to the time the write is committed, stored as an ISO-8601 string.
     */
    public static FieldValue serverTimestamp() {
        return SERVER_TIMESTAMP;
    }

    /**
     * Computes the value to store.
     *
     * @param existing the currently stored value, or null
     * @param commitTime the commit's timestamp
     * @return the new field value
     */
    JsonElement resolve(JsonElement existing, Instant commitTime) {
        switch (kind) {
            case LITERAL:
                return literal.deepCopy();
            case INCREMENT:
                long base = 0;
                if (existing != null && existing.isJsonPrimitive() && existing.getAsJsonPrimitive().isNumber()) {
                    base = existing.getAsLong();
                }
                return new JsonPrimitive(base + delta);
            case SERVER_TIMESTAMP:
                return new JsonPrimitive(commitTime.toString());
            default:
                throw new IllegalStateException("Unhandled field value kind: " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue other)) return false;
        return kind == other.kind && delta == other.delta && Objects.equals(literal, other.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, literal, delta);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INCREMENT:
                return "increment(" + delta + ")";
            case SERVER_TIMESTAMP:
                return "serverTimestamp()";
            default:
                return String.valueOf(literal);
        }
    }
}
