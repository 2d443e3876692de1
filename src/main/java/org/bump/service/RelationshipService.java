package org.bump.service;

import lombok.extern.slf4j.Slf4j;
import org.bump.dto.ProfileSummary;
import org.bump.dto.RelationshipLists;
import org.bump.dto.RelationshipView;
import org.bump.error.*;
import org.bump.model.Relationship;
import org.bump.model.RelationshipState;
import org.bump.repo.RelationshipRepository;
import org.bump.repo.UtilisateurRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Cycle de vie des relations d'amitié : demande, acceptation, suppression, « Hope to Bump ».
 * Chaque opération renvoie un {@link Result} au lieu de lever une exception.
 */
@Slf4j
@Service
public class RelationshipService {

    private final RelationshipRepository relationshipRepo;
    private final UtilisateurRepository utilisateurRepo;
    private final Hydrator hydrator;
    private final Clock clock;
    private final int minQueryLength;
    private final int maxResults;

    public RelationshipService(RelationshipRepository relationshipRepo,
                               UtilisateurRepository utilisateurRepo,
                               Hydrator hydrator,
                               Clock clock,
                               @Value("${bump.search.min-length:3}") int minQueryLength,
                               @Value("${bump.search.max-results:10}") int maxResults) {
        this.relationshipRepo = relationshipRepo;
        this.utilisateurRepo = utilisateurRepo;
        this.hydrator = hydrator;
        this.clock = clock;
        this.minQueryLength = minQueryLength;
        this.maxResults = maxResults;
    }

    // ✅ envoyer une demande
    public Result<RelationshipView> proposeRelationship(Long requesterId, Long recipientId) {
        return Results.capture("proposeRelationship", () -> {
            if (requesterId == null || recipientId == null) {
                throw new ValidationException("Destinataire manquant");
            }
            if (requesterId.equals(recipientId)) {
                throw new ValidationException("Impossible de t'ajouter toi-même");
            }
            if (!utilisateurRepo.existsById(recipientId)) {
                throw new NotFoundException("Utilisateur inexistant");
            }
            if (relationshipRepo.existsByPairKey(Relationship.pairKey(requesterId, recipientId))) {
                throw new DuplicateRelationshipException();
            }

            Relationship saved;
            try {
                // flush immédiat : une insertion concurrente sur la même paire échoue ici
                saved = relationshipRepo.saveAndFlush(Relationship.propose(requesterId, recipientId, clock.instant()));
            } catch (DataIntegrityViolationException e) {
                throw new DuplicateRelationshipException();
            }
            log.info("Demande {} envoyée : {} -> {}", saved.getId(), requesterId, recipientId);
            return view(saved, requesterId);
        });
    }

    // ✅ accepter (destinataire seulement)
    public Result<RelationshipView> acceptRelationship(Long relationshipId, Long actingUserId) {
        return Results.capture("acceptRelationship", () -> {
            Relationship r = load(relationshipId);
            Instant now = clock.instant();
            r.accept(actingUserId, now);
            int updated = relationshipRepo.updateStatusByRecipient(
                    relationshipId, actingUserId, Relationship.Status.PENDING, Relationship.Status.ACCEPTED, now);
            if (updated == 0) {
                throw changedMeanwhile(relationshipId, "Seul le destinataire peut accepter cette demande");
            }
            log.info("Demande {} acceptée par {}", relationshipId, actingUserId);
            return view(r, actingUserId);
        });
    }

    // ✅ refuser, annuler ou retirer un ami : même opération
    public Result<Void> removeRelationship(Long relationshipId, Long actingUserId) {
        return Results.run("removeRelationship", () -> {
            Relationship r = load(relationshipId);
            if (!r.isParty(actingUserId)) {
                throw new NotAuthorizedException("Cette relation ne vous concerne pas");
            }
            relationshipRepo.delete(r);
            log.info("Relation {} supprimée par {} (était {})", r.getId(), actingUserId, r.getStatus());
        });
    }

    public Result<RelationshipView> setHopeToBump(Long relationshipId, Long actingUserId, boolean value) {
        return Results.capture("setHopeToBump", () -> {
            Relationship r = load(relationshipId);
            Instant now = clock.instant();
            r.changeHopeToBump(actingUserId, value, now);
            if (relationshipRepo.updateHopeToBumpByRequester(relationshipId, actingUserId, value, now) == 0) {
                throw changedMeanwhile(relationshipId, "Seul l'auteur de la demande peut modifier « Hope to Bump »");
            }
            return view(r, actingUserId);
        });
    }

    // Une seule requête, puis classement selon l'état de chaque ligne
    public Result<RelationshipLists> listRelationships(Long userId) {
        return Results.capture("listRelationships", () -> {
            List<Relationship> rows = relationshipRepo.findParticipating(userId);
            Map<Long, ProfileSummary> profiles = hydrator.profiles(
                    rows.stream().map(r -> r.counterpartOf(userId)).toList());

            RelationshipLists lists = new RelationshipLists();
            for (Relationship r : rows) {
                RelationshipView v = RelationshipView.of(r, profiles.get(r.counterpartOf(userId)));
                RelationshipState state = r.state();
                if (state instanceof RelationshipState.Accepted) {
                    lists.getAccepted().add(v);
                } else if (state instanceof RelationshipState.Pending pending) {
                    if (pending.to().equals(userId)) {
                        lists.getPendingReceived().add(v);
                    } else {
                        lists.getPendingSent().add(v);
                    }
                }
            }
            return lists;
        });
    }

    public Result<List<ProfileSummary>> searchCandidates(String query, Long excludingUserId) {
        String q = query == null ? "" : query.trim();
        // requête trop courte : pas d'accès à la base
        if (q.length() < minQueryLength) {
            return Result.ok(List.of());
        }
        return Results.capture("searchCandidates", () -> {
            if (excludingUserId == null) {
                throw new ValidationException("Utilisateur courant manquant");
            }
            return utilisateurRepo
                    .findByPseudoContainingIgnoreCaseAndIdNotOrderByPseudoAsc(q, excludingUserId, PageRequest.of(0, maxResults))
                    .stream()
                    .map(ProfileSummary::of)
                    .toList();
        });
    }

    /** Ids des amis acceptés de l'utilisateur. Lève les erreurs de la base telles quelles. */
    public Set<Long> friendIdsOf(Long userId) {
        Set<Long> ids = new HashSet<>();
        for (Relationship r : relationshipRepo.findParticipating(userId)) {
            if (r.state() instanceof RelationshipState.Accepted) {
                ids.add(r.counterpartOf(userId));
            }
        }
        return ids;
    }

    private Relationship load(Long relationshipId) {
        if (relationshipId == null) {
            throw new ValidationException("Relation manquante");
        }
        return relationshipRepo.findById(relationshipId)
                .orElseThrow(() -> new NotFoundException("Relation introuvable"));
    }

    // La ligne a bougé entre la lecture et la mise à jour : supprimée ou déjà passée dans un autre état
    private BumpException changedMeanwhile(Long relationshipId, String refusal) {
        if (!relationshipRepo.existsById(relationshipId)) {
            return new NotFoundException("Relation introuvable");
        }
        return new NotAuthorizedException(refusal);
    }

    private RelationshipView view(Relationship r, Long viewerId) {
        Long other = r.counterpartOf(viewerId);
        return RelationshipView.of(r, hydrator.profiles(List.of(other)).get(other));
    }
}
