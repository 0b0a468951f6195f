package com.example.pos.product;

import com.example.pos.utils.MoneySerializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Product {
    private Long id;

    private String code;

    private String description;

    @lombok.Builder.Default
    private String uom = "pcs";

    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("buy_price")
    @lombok.Builder.Default
    private BigDecimal buyPrice = BigDecimal.ZERO;

    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("sell_price")
    @lombok.Builder.Default
    private BigDecimal sellPrice = BigDecimal.ZERO;

    @JsonProperty("default_number")
    @lombok.Builder.Default
    private BigDecimal defaultNumber = BigDecimal.ZERO;

    @lombok.Builder.Default
    private BigDecimal stock = BigDecimal.ZERO;

    @JsonProperty("reorder_level")
    @lombok.Builder.Default
    private BigDecimal reorderLevel = BigDecimal.ZERO;
}
