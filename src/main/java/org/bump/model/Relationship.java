package org.bump.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bump.error.NotAuthorizedException;

import java.time.Instant;

/**
 * Arête d'amitié entre deux profils. Une seule ligne par paire non ordonnée,
 * garantie par la contrainte unique sur {@code pair_key}.
 */
@Entity
@Table(name = "relationships")
@Data
@NoArgsConstructor
public class Relationship {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long requesterId;

    @Column(nullable = false)
    private Long recipientId;

    // "petitId:grandId", identique quel que soit le sens de la demande
    @Column(name = "pair_key", nullable = false, unique = true)
    private String pairKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status = Status.PENDING;

    private boolean hopeToBump;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    public enum Status {
        PENDING, ACCEPTED, REJECTED
    }

    public static String pairKey(Long a, Long b) {
        return a < b ? a + ":" + b : b + ":" + a;
    }

    public static Relationship propose(Long requesterId, Long recipientId, Instant now) {
        Relationship r = new Relationship();
        r.setRequesterId(requesterId);
        r.setRecipientId(recipientId);
        r.setPairKey(pairKey(requesterId, recipientId));
        r.setStatus(Status.PENDING);
        r.setHopeToBump(false);
        r.setCreatedAt(now);
        return r;
    }

    public RelationshipState state() {
        return switch (status) {
            case PENDING -> new RelationshipState.Pending(requesterId, recipientId);
            case ACCEPTED -> new RelationshipState.Accepted(requesterId, recipientId);
            case REJECTED -> new RelationshipState.Rejected(requesterId, recipientId);
        };
    }

    public boolean isParty(Long userId) {
        return state().involves(userId);
    }

    public Long counterpartOf(Long userId) {
        return requesterId.equals(userId) ? recipientId : requesterId;
    }

    // pending -> accepted, seulement par le destinataire
    public void accept(Long actingUserId, Instant now) {
        if (!(state() instanceof RelationshipState.Pending pending) || !pending.to().equals(actingUserId)) {
            throw new NotAuthorizedException("Seul le destinataire peut accepter cette demande");
        }
        status = Status.ACCEPTED;
        updatedAt = now;
    }

    // Le drapeau appartient au demandeur d'origine, pas à l'autre partie
    public void changeHopeToBump(Long actingUserId, boolean value, Instant now) {
        if (!requesterId.equals(actingUserId)) {
            throw new NotAuthorizedException("Seul l'auteur de la demande peut modifier « Hope to Bump »");
        }
        hopeToBump = value;
        updatedAt = now;
    }
}
