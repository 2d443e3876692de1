package org.bump.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Profil public d'un utilisateur. La table est alimentée par le service de comptes,
 * ici on ne fait que la lire (hydratation, recherche, résolution du principal).
 */
@Entity
@Table(name = "profile")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Utilisateur {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Identifiant du principal JWT
    @Column(unique = true, nullable = false)
    private String email;

    // Identifiant public, seul champ interrogé par la recherche
    @Column(name = "handle", unique = true, nullable = false)
    private String pseudo;

    @Column(name = "display_name")
    private String nomAffiche;
}
