package com.example.pos.sale;

import com.example.pos.invoice.InvoiceData;
import com.example.pos.invoice.InvoiceService;
import com.example.pos.security.CurrentActor;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.servlet.http.HttpServletRequest;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cart checkout. The acting user comes from the bearer token, never from the body.
 */
@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
public class CheckoutController {

    private final SaleService saleService;
    private final InvoiceService invoiceService;

    @PostMapping
    public ResponseEntity<InvoiceData> create(@RequestBody CheckoutRequest req, HttpServletRequest request) {
        long saleId = saleService.createSale(req.getCustomerPhone(), req.getLines(), req.getPaidAmount(),
                req.getPaymentMethod(), CurrentActor.username(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(invoiceService.buildInvoiceData(saleId));
    }

    @PostMapping("/by-code")
    public ResponseEntity<InvoiceData> createByCode(@RequestBody CheckoutByCodeRequest req,
            HttpServletRequest request) {
        long saleId = saleService.createSaleByCode(req.getCustomerPhone(), req.getLines(), req.getPaidAmount(),
                req.getPaymentMethod(), CurrentActor.username(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(invoiceService.buildInvoiceData(saleId));
    }

    @Data
    public static class CheckoutRequest {
        @JsonProperty("customer_phone")
        private String customerPhone;
        private List<SaleLine> lines;
        @JsonProperty("paid_amount")
        private BigDecimal paidAmount;
        @JsonProperty("payment_method")
        private String paymentMethod;
    }

    @Data
    public static class CheckoutByCodeRequest {
        @JsonProperty("customer_phone")
        private String customerPhone;
        private List<SaleLineByCode> lines;
        @JsonProperty("paid_amount")
        private BigDecimal paidAmount;
        @JsonProperty("payment_method")
        private String paymentMethod;
    }
}
