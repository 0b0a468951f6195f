package com.example.pos.sale;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A cart line as scanned at the counter: product code and quantity only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SaleLineByCode {
    private String code;
    private BigDecimal quantity;
}
