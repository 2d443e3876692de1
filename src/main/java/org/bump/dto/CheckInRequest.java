package org.bump.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;
import org.bump.model.Privacy;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckInRequest {
    @NotNull(message = "Lieu manquant")
    private Long placeId;

    @Size(max = 140, message = "Activité trop longue (140 caractères max)")
    private String activity;

    private Privacy privacy;      // FRIENDS si absent
    private Instant expiresAt;    // maintenant + TTL par défaut si absent
}
