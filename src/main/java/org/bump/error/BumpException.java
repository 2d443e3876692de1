package org.bump.error;

import lombok.Getter;

/**
 * Échec métier attendu. Levée à l'intérieur des moteurs puis convertie en {@link Result}
 * par {@link Results#capture}.
 */
@Getter
public class BumpException extends RuntimeException {
    private final ErrorKind kind;

    public BumpException(ErrorKind kind, String message) {
        super(message != null ? message : kind.getDefaultMessage());
        this.kind = kind;
    }

    public BumpError toError() {
        return new BumpError(kind, getMessage());
    }
}
