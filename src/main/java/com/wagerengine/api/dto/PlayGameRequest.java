package com.wagerengine.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for settling a wager.
 *
 * {@code won} is reported by the caller and taken as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayGameRequest {

    @NotNull(message = "Bet amount is required")
    @PositiveOrZero(message = "Bet amount must not be negative")
    private Long betAmount;

    @NotNull(message = "Outcome is required")
    private Boolean won;
}
