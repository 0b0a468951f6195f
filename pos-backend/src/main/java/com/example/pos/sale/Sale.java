package com.example.pos.sale;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.math.BigDecimal;

/**
 * Sale header as stored. {@code total} is frozen at creation; the balance is derived.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Sale {
    private Long id;

    @JsonProperty("customer_phone")
    private String customerPhone;

    private BigDecimal total;

    private BigDecimal paid;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("created_by")
    private String createdBy;

    public BigDecimal getBalance() {
        return total.subtract(paid);
    }
}
