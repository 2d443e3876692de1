package org.bump.error;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BumpError {
    private ErrorKind kind;
    private String message;

    public static BumpError of(ErrorKind kind) {
        return new BumpError(kind, kind.getDefaultMessage());
    }
}
