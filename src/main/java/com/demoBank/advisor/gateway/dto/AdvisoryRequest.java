package com.demoBank.advisor.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for advisory chat turns.
 * Contains only the prompt - the user id and bearer token come from HTTP headers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdvisoryRequest {

    @NotBlank(message = "prompt cannot be blank")
    private String prompt;
}
