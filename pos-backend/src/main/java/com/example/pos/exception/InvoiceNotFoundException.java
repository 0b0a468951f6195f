package com.example.pos.exception;

import lombok.Getter;

@Getter
public class InvoiceNotFoundException extends NotFoundException {

    private final long saleId;

    public InvoiceNotFoundException(long saleId) {
        super("Invoice not found: " + saleId);
        this.saleId = saleId;
    }
}
