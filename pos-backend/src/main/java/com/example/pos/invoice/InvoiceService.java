package com.example.pos.invoice;

import com.example.pos.customer.Customer;
import com.example.pos.customer.CustomerRepository;
import com.example.pos.exception.InvoiceNotFoundException;
import com.example.pos.sale.PaymentMethods;
import com.example.pos.sale.Sale;
import com.example.pos.sale.SaleRepository;
import com.example.pos.utils.Decimals;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

@Service
@RequiredArgsConstructor
public class InvoiceService {

    public static final String WALK_IN_CUSTOMER = "Walk-in Customer";

    private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

    // products may have been deleted since the sale; the line still prints
    private static final RowMapper<InvoiceItem> ITEM_MAPPER = (rs, rowNum) -> {
        String code = rs.getString("code");
        String description = rs.getString("description");
        BigDecimal quantity = Decimals.fromDb(rs.getDouble("quantity"));
        BigDecimal price = Decimals.fromDb(rs.getDouble("price"));
        return new InvoiceItem(code == null ? "" : code, description == null ? "" : description,
                quantity, price, quantity.multiply(price));
    };

    private final JdbcTemplate jdbcTemplate;
    private final SaleRepository saleRepository;
    private final CustomerRepository customerRepository;

    public InvoiceData buildInvoiceData(long saleId) {
        Sale sale = saleRepository.findById(saleId)
                .orElseThrow(() -> new InvoiceNotFoundException(saleId));

        String customerName = customerRepository.findByPhone(sale.getCustomerPhone())
                .map(Customer::getName)
                .orElse(WALK_IN_CUSTOMER);
        String paymentMethod = saleRepository.latestPaymentMethod(saleId).orElse(PaymentMethods.CASH);

        List<InvoiceItem> items = jdbcTemplate.query("""
                SELECT p.code, p.description, l.quantity, l.price
                FROM sale_lines l
                LEFT JOIN products p ON p.id = l.item_id
                WHERE l.sale_id = ?
                ORDER BY l.id ASC
                """, ITEM_MAPPER, saleId);
        BigDecimal subtotal = items.stream()
                .map(InvoiceItem::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        log.debug("Invoice {} projected with {} items", saleId, items.size());
        return InvoiceData.builder()
                .invoiceNo(sale.getId())
                .customerName(customerName)
                .customerPhone(sale.getCustomerPhone())
                .date(sale.getCreatedAt())
                .items(items)
                .subtotal(subtotal)
                .tax(BigDecimal.ZERO)
                .total(sale.getTotal())
                .paidAmount(sale.getPaid())
                .paymentMethod(paymentMethod)
                .build();
    }
}
