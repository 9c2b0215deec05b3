package com.gurukul.karmaLedger.karma.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RewardRequest {

    private Map<String, Object> balances;

    @NotBlank(message = "action cannot be blank")
    private String action;

    @NotNull(message = "baseReward is required")
    private Double baseReward;
}
