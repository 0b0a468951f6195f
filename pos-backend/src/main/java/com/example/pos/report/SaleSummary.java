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
 * One row of a sales listing. {@code customerName} is null for walk-in sales.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SaleSummary {
    private long id;
    @JsonProperty("customer_name")
    private String customerName;
    @JsonSerialize(using = MoneySerializer.class)
    private BigDecimal total;
    @JsonSerialize(using = MoneySerializer.class)
    private BigDecimal paid;
    @JsonSerialize(using = MoneySerializer.class)
    private BigDecimal balance;
    @JsonProperty("created_at")
    private String createdAt;
    @JsonProperty("created_by")
    private String createdBy;
}
