package com.example.pos.exception;

public class CustomerNotFoundException extends NotFoundException {

    public CustomerNotFoundException(String phone) {
        super("Customer not found: " + phone);
    }
}
