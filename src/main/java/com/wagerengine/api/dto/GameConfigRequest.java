package com.wagerengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for replacing a game configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameConfigRequest {

    @NotNull(message = "Minimum bet is required")
    @PositiveOrZero
    private Long minBet;

    @NotNull(message = "Maximum bet is required")
    @PositiveOrZero
    private Long maxBet;

    @NotNull(message = "Payout multiplier is required")
    @PositiveOrZero
    private Long payoutMultiplierBps;

    @NotNull(message = "Active flag is required")
    private Boolean active;

    @NotBlank(message = "Display name is required")
    private String displayName;
}
