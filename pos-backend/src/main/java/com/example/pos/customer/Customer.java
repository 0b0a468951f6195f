package com.example.pos.customer;

import com.example.pos.utils.DateTimeUtils;
import com.example.pos.utils.MoneySerializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.*;

import java.math.BigDecimal;

/**
 * Customer keyed by phone number; there is no surrogate id.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Customer {
    public static final String STATUS_ACTIVE = "Active";
    public static final String STATUS_DISABLED = "Disactive";

    private String phone;

    private String name;

    private String address;

    private String dob;

    private String email;

    @lombok.Builder.Default
    private String status = STATUS_ACTIVE;

    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("credit_limit")
    @lombok.Builder.Default
    private BigDecimal creditLimit = BigDecimal.ZERO;

    /** Date of birth as shown at the counter ({@code dd-MM-yyyy}), or "-" when unknown. */
    @JsonProperty(value = "dob_display", access = JsonProperty.Access.READ_ONLY)
    public String getDobDisplay() {
        return DateTimeUtils.formatDobForDisplay(dob);
    }
}
