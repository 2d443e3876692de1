package org.bump.controller;

import org.bump.error.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

// Traduit un Result en réponse HTTP : le statut suit le type d'erreur, le corps reste {data, error}
final class ResultResponses {

    private ResultResponses() {
    }

    static <T> ResponseEntity<Result<T>> of(Result<T> result) {
        return of(result, HttpStatus.OK);
    }

    static <T> ResponseEntity<Result<T>> created(Result<T> result) {
        return of(result, HttpStatus.CREATED);
    }

    private static <T> ResponseEntity<Result<T>> of(Result<T> result, HttpStatus success) {
        if (result.isOk()) {
            return ResponseEntity.status(success).body(result);
        }
        return ResponseEntity.status(result.getError().getKind().getStatus()).body(result);
    }
}
