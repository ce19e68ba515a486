package com.wagerengine.api.dto;

import com.wagerengine.access.Role;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for granting or revoking a capability.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CapabilityRequest {

    @NotNull(message = "Role is required")
    private Role role;

    @NotBlank(message = "Identity is required")
    private String identity;
}
