package org.bump.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Déclaration de présence d'un utilisateur dans un lieu, limitée dans le temps.
 * Jamais supprimée : l'expiration se fait en plaçant {@code expiresAt} à maintenant.
 */
@Entity
@Table(name = "presence")
@Data
@NoArgsConstructor
public class CheckIn {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long subjectId;

    @Column(nullable = false)
    private Long placeId;

    @Column(length = 140)
    private String activity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Privacy privacy = Privacy.FRIENDS;

    @Column(nullable = false)
    private Instant createdAt;

    // null = pas d'expiration, reste actif indéfiniment
    private Instant expiresAt;

    public boolean isActiveAt(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }

    public void expire(Instant now) {
        if (isActiveAt(now)) {
            expiresAt = now;
        }
    }
}
