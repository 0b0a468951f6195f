package com.example.pos.report;

import com.example.pos.utils.MoneySerializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Current-month figures. {@code cashSales} is the total of fully paid sales that received at
 * least one cash payment; {@code creditSales} is whatever remains of the month total. This is
 * not a per-payment split.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyStats {
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("total_sales")
    private BigDecimal totalSales;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("cash_sales")
    private BigDecimal cashSales;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("credit_sales")
    private BigDecimal creditSales;
}
