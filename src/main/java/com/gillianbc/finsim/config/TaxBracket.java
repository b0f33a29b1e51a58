package com.gillianbc.finsim.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of a marginal tax schedule: income at or above {@code threshold} is taxed at
 * {@code rate} until the next row's threshold.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaxBracket {

    private BigDecimal threshold;
    private BigDecimal rate;
}
