package com.stashguard.persistence;

import java.util.ArrayList;
import java.util.List;

/**
 * Slash-separated address of a document: alternating collection names and document ids,
 * for example {@code players/p1/stash/current}.
 */
public record DocumentPath(List<String> segments) {

    public DocumentPath {
        if (segments == null || segments.isEmpty() || segments.size() % 2 != 0) {
            throw new IllegalArgumentException("Document path needs collection/id pairs: " + segments);
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank() || segment.contains("/")
                    || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Invalid document path segment: '" + segment + "'");
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * Creates a path to a top-level document.
     */
    public static DocumentPath of(String collection, String id) {
        return new DocumentPath(List.of(collection, id));
    }

    /**
     * Parses a slash-separated path.
     */
    public static DocumentPath parse(String path) {
        return new DocumentPath(List.of(path.split("/")));
    }

    /**
     * Creates the path of a document in a subcollection of this document.
     */
    public DocumentPath child(String collection, String id) {
        List<String> childSegments = new ArrayList<>(segments);
        childSegments.add(collection);
        childSegments.add(id);
        return new DocumentPath(childSegments);
    }

    /**
     * @return the top-level document this path lives under (itself if top-level)
     */
    public DocumentPath root() {
        return isRoot() ? this : new DocumentPath(segments.subList(0, 2));
    }

    public boolean isRoot() {
        return segments.size() == 2;
    }

    public String collection() {
        return segments.get(segments.size() - 2);
    }

    public String id() {
        return segments.get(segments.size() - 1);
    }

    @Override
    public String toString() {
        return String.join("/", segments);
    }
}
