package org.bump.error;

public class DuplicateRelationshipException extends BumpException {
    public DuplicateRelationshipException() {
        super(ErrorKind.DUPLICATE_RELATIONSHIP, null);
    }
}
