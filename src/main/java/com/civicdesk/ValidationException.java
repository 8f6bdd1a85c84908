package com.civicdesk;

import java.util.Collections;
import java.util.List;

/**
 * A submission is missing required fields. Nothing has been stored when this is thrown.
 */
public class ValidationException extends IllegalArgumentException {

    private final List<String> fields;

    public ValidationException(List<String> fields) {
        super("Missing required field(s): " + String.join(", ", fields));
        this.fields = Collections.unmodifiableList(fields);
    }

    public List<String> getFields() {
        return fields;
    }
}
