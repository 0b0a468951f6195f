package com.example.pos.customer;

import com.example.pos.exception.CustomerNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerRepository customerRepository;

    @GetMapping
    public List<Customer> list() {
        return customerRepository.list();
    }

    @GetMapping("/{phone}")
    public Customer get(@PathVariable("phone") String phone) {
        return customerRepository.findByPhone(phone).orElseThrow(() -> new CustomerNotFoundException(phone));
    }

    @PostMapping
    public Customer save(@RequestBody Customer body) {
        return customerRepository.upsert(body);
    }
}
