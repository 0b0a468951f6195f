package com.example.pos.product;

import com.example.pos.exception.InvalidProductException;
import com.example.pos.exception.ProductNotFoundException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private static final Logger log = LoggerFactory.getLogger(ProductController.class);

    private final ProductRepository productRepository;

    @GetMapping
    public List<Product> list() {
        return productRepository.list();
    }

    @GetMapping("/{id}")
    public Product getById(@PathVariable("id") long id) {
        return productRepository.getById(id).orElseThrow(() -> ProductNotFoundException.forId(id));
    }

    @GetMapping("/code/{code}")
    public Product getByCode(@PathVariable("code") String code) {
        return productRepository.findByCode(code).orElseThrow(() -> new ProductNotFoundException(code));
    }

    /**
     * Saves a product keyed by its code: an existing code keeps its row id and gets every other
     * field overwritten.
     */
    @PostMapping
    public Product save(@RequestBody Product body) {
        if (body == null || !StringUtils.hasText(body.getCode())) {
            throw new InvalidProductException("Product code is required");
        }
        String code = body.getCode().trim();
        Long existingId = productRepository.findByCode(code).map(Product::getId).orElse(null);
        Product saved = productRepository.upsert(body.toBuilder().id(existingId).code(code).build());
        log.info("Product {} saved (id={}, {})", code, saved.getId(), existingId == null ? "created" : "updated");
        return saved;
    }
}
