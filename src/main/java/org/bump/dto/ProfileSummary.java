package org.bump.dto;

import lombok.*;
import org.bump.model.Utilisateur;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProfileSummary {
    private Long id;
    private String pseudo;
    private String nomAffiche;

    public static ProfileSummary of(Utilisateur u) {
        return new ProfileSummary(u.getId(), u.getPseudo(), u.getNomAffiche());
    }
}
