package com.example.pos.invoice;

import com.example.pos.utils.MoneySerializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Flat, render-ready view of one sale. {@code subtotal} is recomputed from the lines while
 * {@code total} is the stored header value; the two normally agree.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InvoiceData {
    @JsonProperty("invoice_no")
    private long invoiceNo;
    @JsonProperty("customer_name")
    private String customerName;
    @JsonProperty("customer_phone")
    private String customerPhone;
    private String date;
    private List<InvoiceItem> items;
    @JsonSerialize(using = MoneySerializer.class)
    private BigDecimal subtotal;
    @JsonSerialize(using = MoneySerializer.class)
    @Builder.Default
    private BigDecimal tax = BigDecimal.ZERO;
    @JsonSerialize(using = MoneySerializer.class)
    private BigDecimal total;
    @JsonSerialize(using = MoneySerializer.class)
    @JsonProperty("paid_amount")
    private BigDecimal paidAmount;
    @JsonProperty("payment_method")
    private String paymentMethod;
}
