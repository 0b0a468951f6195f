package com.example.pos.report;

import com.example.pos.utils.MoneySerializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-actor rollup. {@code displayName} falls back to the raw {@code created_by} value when no
 * user account matches it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserSalesSummary {
    private String username;
    @JsonProperty("display_name")
    private String displayName;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("total_sales")
    private BigDecimal totalSales;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("total_paid")
    private BigDecimal totalPaid;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("total_balance")
    private BigDecimal totalBalance;
    @JsonProperty("invoice_count")
    private long invoiceCount;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("cash_sales")
    @Builder.Default
    private BigDecimal cashSales = BigDecimal.ZERO;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("credit_sales")
    @Builder.Default
    private BigDecimal creditSales = BigDecimal.ZERO;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("mobile_sales")
    @Builder.Default
    private BigDecimal mobileSales = BigDecimal.ZERO;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("card_sales")
    @Builder.Default
    private BigDecimal cardSales = BigDecimal.ZERO;
}
