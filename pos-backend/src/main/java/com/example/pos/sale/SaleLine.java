package com.example.pos.sale;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A cart line already resolved against the catalog: product id and the unit price captured
 * when the line was built.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SaleLine {
    @JsonProperty("item_id")
    private Long itemId;
    private BigDecimal quantity;
    private BigDecimal price;

    public BigDecimal extension() {
        return quantity.multiply(price);
    }
}
