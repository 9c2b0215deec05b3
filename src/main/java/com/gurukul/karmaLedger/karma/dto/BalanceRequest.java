package com.gurukul.karmaLedger.karma.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO carrying a raw balance sheet. Missing balances read as an empty sheet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BalanceRequest {

    private Map<String, Object> balances;
}
