package com.example.pos.exception;

import lombok.Getter;

@Getter
public class ProductNotFoundException extends NotFoundException {

    private final String code;

    public ProductNotFoundException(String code) {
        super("Product not found: " + code);
        this.code = code;
    }

    public static ProductNotFoundException forId(long id) {
        return new ProductNotFoundException("#" + id);
    }
}
