package org.bump.security;

import lombok.RequiredArgsConstructor;
import org.bump.error.NotAuthorizedException;
import org.bump.model.Utilisateur;
import org.bump.repo.UtilisateurRepository;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Résout le principal authentifié (email) en id de profil.
 */
@Component
@RequiredArgsConstructor
public class CurrentUser {

    private final UtilisateurRepository utilisateurRepo;

    public Long idOf(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new NotAuthorizedException("Connexion requise");
        }
        return utilisateurRepo.findByEmail(authentication.getName())
                .map(Utilisateur::getId)
                .orElseThrow(() -> new NotAuthorizedException("Profil introuvable pour ce compte"));
    }
}
