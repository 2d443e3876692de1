package org.bump.error;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Paire {data, error} renvoyée par toutes les opérations des moteurs.
 * Exactement un des deux champs est renseigné (data peut être null pour une opération sans résultat).
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Result<T> {
    private final T data;
    private final BumpError error;

    public static <T> Result<T> ok(T data) {
        return new Result<>(data, null);
    }

    public static <T> Result<T> fail(BumpError error) {
        return new Result<>(null, error);
    }

    public static <T> Result<T> fail(ErrorKind kind, String message) {
        return new Result<>(null, new BumpError(kind, message));
    }

    @JsonIgnore
    public boolean isOk() {
        return error == null;
    }

    /** Renvoie data ou relance l'erreur sous forme de {@link BumpException}. */
    public T orElseThrow() {
        if (error != null) {
            throw new BumpException(error.getKind(), error.getMessage());
        }
        return data;
    }
}
