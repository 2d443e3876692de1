package org.bump.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ProposeRequest {
    @NotNull(message = "Destinataire manquant")
    private Long recipientId;
}
