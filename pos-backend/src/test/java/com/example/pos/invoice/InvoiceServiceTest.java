package com.example.pos.invoice;

import com.example.pos.StoreTestSupport;
import com.example.pos.customer.Customer;
import com.example.pos.customer.CustomerRepository;
import com.example.pos.exception.InvoiceNotFoundException;
import com.example.pos.sale.SaleLineByCode;
import com.example.pos.sale.SaleRepository;
import com.example.pos.sale.SaleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvoiceServiceTest extends StoreTestSupport {

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private SaleService saleService;

    @Autowired
    private SaleRepository saleRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Test
    void walkInSaleProjectsAllLinesInOrder() {
        product("P001", "10.0", "5");
        product("P002", "2.5", "5");
        long saleId = saleService.createSaleByCode(null, List.of(
                new SaleLineByCode("P002", new BigDecimal("2")),
                new SaleLineByCode("P001", BigDecimal.ONE)), new BigDecimal("12"), "CASH", "alice");

        InvoiceData invoice = invoiceService.buildInvoiceData(saleId);

        assertThat(invoice.getInvoiceNo()).isEqualTo(saleId);
        assertThat(invoice.getCustomerName()).isEqualTo(InvoiceService.WALK_IN_CUSTOMER);
        assertThat(invoice.getCustomerPhone()).isNull();
        assertThat(invoice.getDate()).isNotBlank();
        assertThat(invoice.getItems()).extracting(InvoiceItem::getCode).containsExactly("P002", "P001");
        InvoiceItem first = invoice.getItems().get(0);
        assertThat(first.getDescription()).isEqualTo("Item P002");
        assertThat(first.getUnitPrice()).isEqualByComparingTo("2.5");
        assertThat(first.getLineTotal()).isEqualByComparingTo("5");
        assertThat(invoice.getSubtotal()).isEqualByComparingTo("15");
        assertThat(invoice.getTax()).isEqualByComparingTo("0");
        assertThat(invoice.getTotal()).isEqualByComparingTo("15");
        assertThat(invoice.getPaidAmount()).isEqualByComparingTo("12");
        assertThat(invoice.getPaymentMethod()).isEqualTo("CASH");
    }

    @Test
    void registeredCustomerNameIsUsed() {
        product("P001", "10.0", "5");
        customerRepository.upsert(Customer.builder().phone("0700").name("Jane Doe").build());
        long saleId = saleService.createSaleByCode("0700", List.of(new SaleLineByCode("P001", BigDecimal.ONE)),
                BigDecimal.TEN, "MOBILE_BANKING", null);

        InvoiceData invoice = invoiceService.buildInvoiceData(saleId);

        assertThat(invoice.getCustomerName()).isEqualTo("Jane Doe");
        assertThat(invoice.getCustomerPhone()).isEqualTo("0700");
        assertThat(invoice.getPaymentMethod()).isEqualTo("MOBILE_BANKING");
    }

    @Test
    void unknownSaleIsNotFound() {
        assertThatThrownBy(() -> invoiceService.buildInvoiceData(999L))
                .isInstanceOf(InvoiceNotFoundException.class)
                .hasMessage("Invoice not found: 999");
    }

    @Test
    void latestPaymentDecidesTheMethod() {
        product("P001", "10.0", "5");
        long saleId = saleService.createSaleByCode(null, List.of(new SaleLineByCode("P001", BigDecimal.ONE)),
                new BigDecimal("4"), "CREDIT", null);
        saleRepository.insertPayment(saleId, "CARD", new BigDecimal("6"), "settle", "alice");

        assertThat(invoiceService.buildInvoiceData(saleId).getPaymentMethod()).isEqualTo("CARD");
    }

    @Test
    void saleWithoutPaymentRowFallsBackToCash() {
        product("P001", "10.0", "5");
        long saleId = saleService.createSaleByCode(null, List.of(new SaleLineByCode("P001", BigDecimal.ONE)),
                BigDecimal.TEN, "CARD", null);
        jdbcTemplate.update("DELETE FROM payments WHERE sale_id = ?", saleId);

        assertThat(invoiceService.buildInvoiceData(saleId).getPaymentMethod()).isEqualTo("CASH");
    }

    @Test
    void deletedProductStillPrintsWithBlankCode() {
        product("P001", "10.0", "5");
        long saleId = saleService.createSaleByCode(null, List.of(new SaleLineByCode("P001", new BigDecimal("2"))),
                new BigDecimal("20"), "CASH", null);
        jdbcTemplate.update("DELETE FROM products WHERE code = ?", "P001");

        InvoiceData invoice = invoiceService.buildInvoiceData(saleId);

        assertThat(invoice.getItems()).hasSize(1);
        assertThat(invoice.getItems().get(0).getCode()).isEmpty();
        assertThat(invoice.getItems().get(0).getDescription()).isEmpty();
        assertThat(invoice.getSubtotal()).isEqualByComparingTo("20");
    }
}
