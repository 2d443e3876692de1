package org.bump.error;

public class NotAuthorizedException extends BumpException {
    public NotAuthorizedException(String message) {
        super(ErrorKind.NOT_AUTHORIZED, message);
    }
}
