package com.example.pos.sale;

import org.springframework.util.StringUtils;

/**
 * Payment methods known to reporting. The {@code payments.method} column itself is an open
 * string.
 */
public final class PaymentMethods {

    public static final String CASH = "CASH";
    public static final String CREDIT = "CREDIT";
    public static final String MOBILE_BANKING = "MOBILE_BANKING";
    public static final String CARD = "CARD";

    private PaymentMethods() {
    }

    public static String orDefault(String method) {
        return StringUtils.hasText(method) ? method.trim() : CASH;
    }
}
