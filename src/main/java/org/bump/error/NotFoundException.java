package org.bump.error;

public class NotFoundException extends BumpException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
