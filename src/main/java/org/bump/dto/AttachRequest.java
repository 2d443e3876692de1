package org.bump.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AttachRequest {
    @NotBlank(message = "Table manquante")
    private String table;
    private String filter;
    private String filterValue;
    private Long intervalMs;
}
