package org.bump.error;

public class ValidationException extends BumpException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
