package org.bump.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class HopeToBumpRequest {
    @NotNull(message = "Valeur manquante")
    private Boolean value;
}
