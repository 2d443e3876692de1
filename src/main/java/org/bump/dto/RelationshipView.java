package org.bump.dto;

import lombok.*;
import org.bump.model.Relationship;

import java.time.Instant;

/**
 * Relation vue depuis un des deux participants : {@code counterpart} est toujours l'autre personne.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RelationshipView {
    private Long id;
    private Long requesterId;
    private Long recipientId;
    private Relationship.Status status;
    private boolean hopeToBump;
    private Instant createdAt;
    private Instant updatedAt;
    private ProfileSummary counterpart;

    public static RelationshipView of(Relationship r, ProfileSummary counterpart) {
        return RelationshipView.builder()
                .id(r.getId())
                .requesterId(r.getRequesterId())
                .recipientId(r.getRecipientId())
                .status(r.getStatus())
                .hopeToBump(r.isHopeToBump())
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt())
                .counterpart(counterpart)
                .build();
    }
}
