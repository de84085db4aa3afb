package com.stashguard.persistence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One pending write inside a {@link WriteBatch}.
 *
 * @param path target document
 * @param merge true to update the named fields of an existing document, false to replace it
 * @param fields field values and transforms, in insertion order
 */
public record DocumentWrite(DocumentPath path, boolean merge, Map<String, FieldValue> fields) {

    public DocumentWrite {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
