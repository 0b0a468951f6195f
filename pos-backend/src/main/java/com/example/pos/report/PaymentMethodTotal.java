package com.example.pos.report;

import com.example.pos.utils.MoneySerializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethodTotal {
    private String method;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("total_amount")
    private BigDecimal totalAmount;
    @JsonProperty("payment_count")
    private long paymentCount;
}
