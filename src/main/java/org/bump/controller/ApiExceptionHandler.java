package org.bump.controller;

import lombok.extern.slf4j.Slf4j;
import org.bump.error.BumpError;
import org.bump.error.BumpException;
import org.bump.error.ErrorKind;
import org.bump.error.Result;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Erreurs levées hors des moteurs (résolution de l'appelant, corps de requête mal formé),
 * renvoyées avec le même corps {data, error}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(BumpException.class)
    public ResponseEntity<Result<Void>> handleBump(BumpException ex) {
        log.debug("Requête refusée ({}): {}", ex.getKind(), ex.getMessage());
        return ResponseEntity.status(ex.getKind().getStatus()).body(Result.fail(ex.toError()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException ex) {
        FieldError first = ex.getBindingResult().getFieldError();
        String message = first != null ? first.getDefaultMessage() : ErrorKind.VALIDATION.getDefaultMessage();
        return ResponseEntity.badRequest().body(Result.fail(ErrorKind.VALIDATION, message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Result<Void>> handleMalformed(Exception ex) {
        log.debug("Requête mal formée : {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Result.fail(BumpError.of(ErrorKind.VALIDATION)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleUnexpected(Exception ex) {
        // 404/405 du framework : on garde leur statut
        if (ex instanceof ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
            return ResponseEntity.status(framework.getStatusCode()).body(Result.fail(ErrorKind.VALIDATION, ex.getMessage()));
        }
        log.error("Erreur inattendue : ", ex);
        return ResponseEntity.status(ErrorKind.UNEXPECTED.getStatus()).body(Result.fail(BumpError.of(ErrorKind.UNEXPECTED)));
    }
}
