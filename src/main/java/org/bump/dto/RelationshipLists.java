package org.bump.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

// Trois partitions disjointes des relations d'un utilisateur
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class RelationshipLists {
    private List<RelationshipView> accepted = new ArrayList<>();
    private List<RelationshipView> pendingReceived = new ArrayList<>();
    private List<RelationshipView> pendingSent = new ArrayList<>();
}
