package org.bump.security;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.Optional;

/**
 * Validation des jetons HS256. Ils sont émis par le service de comptes avec le même secret,
 * ce service ne fait que vérifier la signature et l'expiration puis lire le sujet (email du profil).
 * Le secret est fourni via "jwt.secret" (clé BASE64 de 32 octets minimum).
 */
@Slf4j
@Component
public class JwtUtil {

    private final JwtParser parser;

    public JwtUtil(@Value("${jwt.secret:}") String jwtSecretBase64,
                   @Value("${jwt.clock-skew-seconds:30}") long clockSkewSeconds) {
        if (jwtSecretBase64 == null || jwtSecretBase64.isBlank()) {
            throw new IllegalStateException("jwt.secret doit être renseigné (base64).");
        }
        this.parser = Jwts.parserBuilder()
                .setSigningKey(Keys.hmacShaKeyFor(Base64.getDecoder().decode(jwtSecretBase64)))
                .setAllowedClockSkewSeconds(clockSkewSeconds)
                .build();
    }

    // Vide si la signature, l'expiration ou le format est refusé, ou s'il n'y a pas de sujet
    public Optional<String> sujetValide(String token) {
        try {
            String subject = parser.parseClaimsJws(token).getBody().getSubject();
            return subject == null || subject.isBlank() ? Optional.empty() : Optional.of(subject);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Jeton refusé : {}", e.getMessage());
            return Optional.empty();
        }
    }
}
