package org.bump.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Taxonomie des erreurs renvoyées dans le champ {@code error} des réponses.
 * Chaque type porte son statut HTTP et un message par défaut affichable tel quel.
 */
@Getter
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST, "Requête invalide"),
    DUPLICATE_RELATIONSHIP(HttpStatus.CONFLICT, "Une demande existe déjà ou vous êtes déjà amis"),
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN, "Vous n'avez pas le droit de faire cette action"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Élément introuvable"),
    STORE(HttpStatus.SERVICE_UNAVAILABLE, "Service momentanément indisponible, réessayez."),
    UNEXPECTED(HttpStatus.INTERNAL_SERVER_ERROR, "Une erreur inattendue est survenue. Réessayez.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorKind(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }
}
