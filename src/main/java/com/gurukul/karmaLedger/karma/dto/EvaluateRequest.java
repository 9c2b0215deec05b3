package com.gurukul.karmaLedger.karma.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for evaluating one action.
 * userId is optional and only used to attribute the ledger entry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequest {

    private String userId;

    private Map<String, Object> balances;

    @NotBlank(message = "action cannot be blank")
    private String action;

    private Double intensity;
}
