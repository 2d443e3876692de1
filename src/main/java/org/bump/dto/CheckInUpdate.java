package org.bump.dto;

import jakarta.validation.constraints.Size;
import lombok.*;
import org.bump.model.Privacy;

import java.time.Instant;

// Mise à jour partielle : un champ null est laissé tel quel
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckInUpdate {
    @Size(max = 140, message = "Activité trop longue (140 caractères max)")
    private String activity;
    private Privacy privacy;
    private Instant expiresAt;
}
