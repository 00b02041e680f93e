package org.worksindex.exceptions;

public class InputSchemaException extends IllegalArgumentException {

    public InputSchemaException(String message) {
        super(message);
    }
}
