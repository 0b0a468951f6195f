package com.example.pos.invoice;

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
public class InvoiceItem {
    private String code;
    private String description;
    private BigDecimal quantity;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("unit_price")
    private BigDecimal unitPrice;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("line_total")
    private BigDecimal lineTotal;
}
