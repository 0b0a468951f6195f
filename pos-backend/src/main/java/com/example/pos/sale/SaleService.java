package com.example.pos.sale;

import com.example.pos.customer.CustomerRepository;
import com.example.pos.exception.CustomerNotFoundException;
import com.example.pos.exception.InvalidLineException;
import com.example.pos.exception.InvalidSaleException;
import com.example.pos.exception.InvalidStateException;
import com.example.pos.exception.ProductNotFoundException;
import com.example.pos.product.Product;
import com.example.pos.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a cart into a sale: header, lines, stock deduction and the initial payment are written
 * in one transaction, so a failure at any step leaves the store as it was.
 */
@Service
@RequiredArgsConstructor
public class SaleService {

    public static final String SYSTEM_ACTOR = "SYSTEM";

    private static final Logger log = LoggerFactory.getLogger(SaleService.class);

    private final SaleRepository saleRepository;
    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;

    /**
     * Records a sale from lines whose product id and unit price are already known.
     *
     * @param customerPhone phone of a registered customer, or null/blank for a walk-in sale
     * @param paidAmount    amount received now; may be below or above the total
     * @param paymentMethod method of the initial payment, {@code CASH} when blank
     * @param createdBy     acting username, stored lower-cased; {@code SYSTEM} when blank
     * @return id of the new sale
     */
    @Transactional
    public long createSale(String customerPhone, List<SaleLine> lines, BigDecimal paidAmount, String paymentMethod,
            String createdBy) {
        requireLines(lines);
        for (SaleLine line : lines) {
            validateResolvedLine(line);
        }
        BigDecimal paid = paidAmount == null ? BigDecimal.ZERO : paidAmount;
        if (paid.signum() < 0) {
            throw new InvalidSaleException("Paid amount cannot be negative");
        }
        String phone = resolveCustomerPhone(customerPhone);
        String method = PaymentMethods.orDefault(paymentMethod);
        String actor = StringUtils.hasText(createdBy) ? createdBy.trim().toLowerCase() : SYSTEM_ACTOR;

        BigDecimal total = lines.stream().map(SaleLine::extension).reduce(BigDecimal.ZERO, BigDecimal::add);

        long saleId = saleRepository.insertSale(phone, total, paid, actor);
        saleRepository.insertLines(saleId, lines);
        saleRepository.deductStock(lines);
        saleRepository.insertPayment(saleId, method, paid, null, actor);

        log.info("Sale {} recorded: lines={}, total={}, paid={}, method={}, by={}", saleId, lines.size(),
                total.toPlainString(), paid.toPlainString(), method, actor);
        return saleId;
    }

    /**
     * Records a sale from product codes. Prices are taken from the catalog at resolution time,
     * then the call reduces to {@link #createSale}.
     */
    @Transactional
    public long createSaleByCode(String customerPhone, List<SaleLineByCode> lines, BigDecimal paidAmount,
            String paymentMethod, String createdBy) {
        List<SaleLine> resolved = resolveLines(lines);
        return createSale(customerPhone, resolved, paidAmount, paymentMethod, createdBy);
    }

    private List<SaleLine> resolveLines(List<SaleLineByCode> lines) {
        requireLines(lines);
        List<SaleLine> resolved = new ArrayList<>(lines.size());
        for (SaleLineByCode line : lines) {
            if (line == null) {
                throw InvalidLineException.forCode(null, null);
            }
            String code = line.getCode() == null ? "" : line.getCode().trim();
            BigDecimal qty = line.getQuantity();
            if (code.isEmpty() || qty == null || qty.signum() <= 0) {
                throw InvalidLineException.forCode(code, qty);
            }
            Product product = productRepository.findByCode(code)
                    .orElseThrow(() -> new ProductNotFoundException(code));
            if (product.getId() == null) {
                log.error("Catalog returned product '{}' without id", code);
                throw new InvalidStateException("Product has no id: " + code);
            }
            resolved.add(new SaleLine(product.getId(), qty, product.getSellPrice()));
        }
        return resolved;
    }

    public Optional<Sale> findSale(long saleId) {
        return saleRepository.findById(saleId);
    }

    public List<SaleLine> findLines(long saleId) {
        return saleRepository.findLines(saleId);
    }

    private void validateResolvedLine(SaleLine line) {
        if (line == null || line.getItemId() == null) {
            throw new InvalidLineException("Invalid line: product id is required");
        }
        if (line.getQuantity() == null || line.getQuantity().signum() <= 0) {
            throw new InvalidLineException("Invalid line: item=" + line.getItemId() + ", qty='"
                    + (line.getQuantity() == null ? "" : line.getQuantity().toPlainString()) + "'");
        }
        if (line.getPrice() == null || line.getPrice().signum() < 0) {
            throw new InvalidLineException("Invalid line: item=" + line.getItemId() + " has no valid price");
        }
        if (productRepository.getById(line.getItemId()).isEmpty()) {
            throw ProductNotFoundException.forId(line.getItemId());
        }
    }

    private String resolveCustomerPhone(String customerPhone) {
        if (!StringUtils.hasText(customerPhone)) {
            return null;
        }
        String phone = customerPhone.trim();
        if (customerRepository.findByPhone(phone).isEmpty()) {
            throw new CustomerNotFoundException(phone);
        }
        return phone;
    }

    private static void requireLines(List<?> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new InvalidSaleException("Sale must have at least one line");
        }
    }
}
