package org.bump.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

/**
 * Frontière d'erreurs des moteurs : exécute une opération et renvoie toujours un {@link Result}.
 */
@Slf4j
public final class Results {

    private Results() {
    }

    public static <T> Result<T> capture(String operation, Supplier<T> body) {
        try {
            return Result.ok(body.get());
        } catch (BumpException e) {
            log.debug("{} refusé ({}): {}", operation, e.getKind(), e.getMessage());
            return Result.fail(e.toError());
        } catch (DataAccessException e) {
            log.error("{} : échec de la base de données", operation, e);
            return Result.fail(BumpError.of(ErrorKind.STORE));
        } catch (RuntimeException e) {
            log.error("{} : erreur inattendue", operation, e);
            return Result.fail(BumpError.of(ErrorKind.UNEXPECTED));
        }
    }

    public static Result<Void> run(String operation, Runnable body) {
        return capture(operation, () -> {
            body.run();
            return null;
        });
    }
}
