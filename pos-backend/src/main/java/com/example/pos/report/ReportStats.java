package com.example.pos.report;

import com.example.pos.utils.MoneySerializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportStats {
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("total_sales")
    @Builder.Default
    private BigDecimal totalSales = BigDecimal.ZERO;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("total_paid")
    @Builder.Default
    private BigDecimal totalPaid = BigDecimal.ZERO;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("total_balance")
    @Builder.Default
    private BigDecimal totalBalance = BigDecimal.ZERO;
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
