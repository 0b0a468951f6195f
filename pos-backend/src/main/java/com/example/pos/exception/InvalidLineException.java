package com.example.pos.exception;

import java.math.BigDecimal;

public class InvalidLineException extends ValidationException {

    public InvalidLineException(String message) {
        super(message);
    }

    public static InvalidLineException forCode(String code, BigDecimal quantity) {
        return new InvalidLineException("Invalid line: code='" + (code == null ? "" : code)
                + "', qty='" + (quantity == null ? "" : quantity.toPlainString()) + "'");
    }
}
