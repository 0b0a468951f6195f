package com.example.pos.common;

import com.example.pos.StoreTestSupport;
import com.example.pos.user.UserRole;
import com.example.pos.user.UserService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class ApiFlowTest extends StoreTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserService userService;

    private String adminToken;
    private String cashierToken;

    @BeforeEach
    void users() throws Exception {
        userService.saveUser("boss", "The Boss", UserRole.ADMIN, "boss-pw");
        userService.saveUser("cashier1", "Till One", UserRole.CASHIER, "till-pw");
        adminToken = login("boss", "boss-pw");
        cashierToken = login("cashier1", "till-pw");
    }

    private String login(String username, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"" + username + "\",\"password\":\"" + password + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(body.path("user").has("passwordHash")).isFalse();
        return body.get("token").asText();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    @Test
    void healthIsOpen() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void apiNeedsAToken() throws Exception {
        mockMvc.perform(get("/api/reports/stats")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/products").header(HttpHeaders.AUTHORIZATION, bearer("not-a-token")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"boss\",\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid credentials"));
    }

    @Test
    void meReturnsTheCaller() throws Exception {
        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(cashierToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("cashier1"))
                .andExpect(jsonPath("$.role").value("CASHIER"));
    }

    @Test
    void cashierSellsByCodeAndSeesOnlyOwnFigures() throws Exception {
        mockMvc.perform(post("/api/products")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"P001\",\"description\":\"Rice 1kg\",\"sell_price\":10.0,\"stock\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").isNumber());

        mockMvc.perform(post("/api/sales/by-code")
                        .header(HttpHeaders.AUTHORIZATION, bearer(cashierToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lines\":[{\"code\":\"P001\",\"quantity\":2}],"
                                + "\"paid_amount\":20.0,\"payment_method\":\"CASH\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.customer_name").value("Walk-in Customer"))
                .andExpect(jsonPath("$.total").value(20.0))
                .andExpect(jsonPath("$.items[0].code").value("P001"))
                .andExpect(jsonPath("$.payment_method").value("CASH"));

        assertThat(stockOf("P001")).isEqualByComparingTo("3");
        String actor = jdbcTemplate.queryForObject("SELECT created_by FROM sales", String.class);
        assertThat(actor).isEqualTo("cashier1");

        mockMvc.perform(get("/api/reports/stats").param("period", "Today")
                        .header(HttpHeaders.AUTHORIZATION, bearer(cashierToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invoice_count").value(1))
                .andExpect(jsonPath("$.cash_sales").value(20.0));

        mockMvc.perform(get("/api/reports/cash").param("period", "Today")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cash_total").value(0.0));

        mockMvc.perform(get("/api/reports/users").header(HttpHeaders.AUTHORIZATION, bearer(cashierToken)))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/reports/users").param("period", "Today")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].username").value("cashier1"))
                .andExpect(jsonPath("$[0].display_name").value("Till One"));
    }

    @Test
    void moneyIsRenderedWithTwoDecimals() throws Exception {
        product("P001", "3.333", "5");

        MvcResult result = mockMvc.perform(post("/api/sales/by-code")
                        .header(HttpHeaders.AUTHORIZATION, bearer(cashierToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lines\":[{\"code\":\"P001\",\"quantity\":1}],\"paid_amount\":5}"))
                .andExpect(status().isCreated())
                .andReturn();

        String json = result.getResponse().getContentAsString();
        assertThat(json).contains("\"total\":3.33").contains("\"paid_amount\":5.00");
    }

    @Test
    void fractionalStockSurvivesReadAndWriteBack() throws Exception {
        product("P002", "3.333", "0.125");
        jdbcTemplate.update("UPDATE products SET default_number = 0.005 WHERE code = 'P002'");

        String json = mockMvc.perform(get("/api/products/code/P002")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        assertThat(json).contains("\"stock\":0.125").contains("\"default_number\":0.005")
                .contains("\"sell_price\":3.33");

        mockMvc.perform(post("/api/products")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isOk());

        assertThat(stockOf("P002")).isEqualByComparingTo("0.125");
        assertThat(productRepository.findByCode("P002").orElseThrow().getDefaultNumber())
                .isEqualByComparingTo("0.005");
    }

    @Test
    void otherActorsSalesAreHiddenFromCashier() throws Exception {
        product("P001", "10.0", "5");
        jdbcTemplate.update("INSERT INTO sales(customer_phone, total, paid, created_by) VALUES (NULL, 50, 50, 'someone')");

        mockMvc.perform(get("/api/reports/sales").param("filter", "all")
                        .header(HttpHeaders.AUTHORIZATION, bearer(cashierToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
        mockMvc.perform(get("/api/reports/sales").param("filter", "all")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].created_by").value("someone"));
    }

    @Test
    void domainErrorsMapToStatusCodes() throws Exception {
        mockMvc.perform(post("/api/sales/by-code")
                        .header(HttpHeaders.AUTHORIZATION, bearer(cashierToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lines\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Sale must have at least one line"));

        mockMvc.perform(post("/api/sales/by-code")
                        .header(HttpHeaders.AUTHORIZATION, bearer(cashierToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lines\":[{\"code\":\"GHOST\",\"quantity\":1}]}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Product not found: GHOST"));

        mockMvc.perform(get("/api/invoices/424242").header(HttpHeaders.AUTHORIZATION, bearer(cashierToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Invoice not found: 424242"));
    }
}
