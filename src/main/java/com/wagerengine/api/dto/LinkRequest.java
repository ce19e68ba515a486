package com.wagerengine.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for linking collaborators by bean name. Null or blank unlinks.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkRequest {

    private String minter;

    private String registry;
}
