package org.bump.repo;

import org.bump.model.Utilisateur;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

// Lecture seule côté Bump : les profils sont créés par le service de comptes
public interface UtilisateurRepository extends JpaRepository<Utilisateur, Long> {
    Optional<Utilisateur> findByEmail(String email);

    // Recherche insensible à la casse sur le pseudo, en excluant l'appelant
    List<Utilisateur> findByPseudoContainingIgnoreCaseAndIdNotOrderByPseudoAsc(String pseudo, Long excludedId, Pageable page);
}
