package org.evalux.poker.dto.poker;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionRequest {
    @NotNull(message = "userId requis")
    private Long userId;

    @NotBlank(message = "action requise")
    private String action;

    @PositiveOrZero(message = "montant invalide")
    private Long amount;
}
