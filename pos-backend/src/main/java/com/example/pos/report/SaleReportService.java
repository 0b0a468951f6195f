package com.example.pos.report;

import com.example.pos.sale.PaymentMethods;
import com.example.pos.utils.Decimals;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregates over {@code sales} and {@code payments}. Every query takes a period
 * predicate and an optional actor scope ({@code sales.created_by}); a null actor means
 * unscoped. Aggregates over no rows come back as zero.
 */
@Service
@RequiredArgsConstructor
public class SaleReportService {

    public static final int DEFAULT_LIMIT = 100;

    private static final Logger log = LoggerFactory.getLogger(SaleReportService.class);
    private static final String SALE_TIME = "s.created_at";
    private static final String SALE_ACTOR = "s.created_by";
    private static final String ALIAS_AMOUNT = "method_total";

    private static final String SUMMARY_SELECT = """
            SELECT s.id, c.name AS customer_name, s.total, s.paid, (s.total - s.paid) AS balance,
                   s.created_at, s.created_by
            FROM sales s
            LEFT JOIN customers c ON c.phone = s.customer_phone
            """;

    private static final RowMapper<SaleSummary> SUMMARY_MAPPER = (rs, rowNum) -> SaleSummary.builder()
            .id(rs.getLong("id"))
            .customerName(rs.getString("customer_name"))
            .total(Decimals.fromDb(rs.getDouble("total")))
            .paid(Decimals.fromDb(rs.getDouble("paid")))
            .balance(Decimals.fromDb(rs.getDouble("balance")))
            .createdAt(rs.getString("created_at"))
            .createdBy(rs.getString("created_by"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public List<SaleSummary> dailySales(String createdBy) {
        return listSales(scoped(ReportPeriod.TODAY, createdBy), null);
    }

    public List<SaleSummary> monthlySales(String createdBy) {
        return listSales(scoped(ReportPeriod.THIS_MONTH, createdBy), null);
    }

    public List<SaleSummary> allSales(Integer limit, String createdBy) {
        int effective = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
        return listSales(scoped(ReportPeriod.ALL, createdBy), effective);
    }

    /** Inclusive on both dates, never scoped to an actor. */
    public List<SaleSummary> salesByDateRange(LocalDate start, LocalDate end) {
        SqlFilter filter = SqlFilter.of("date(" + SALE_TIME + ") BETWEEN ? AND ?", start.toString(), end.toString());
        return listSales(filter, null);
    }

    public ReportStats getStatsForPeriod(ReportPeriod period, String createdBy) {
        SqlFilter filter = scoped(period, createdBy);
        ReportStats stats = jdbcTemplate.queryForObject("""
                SELECT COALESCE(SUM(s.total), 0) AS total_sales,
                       COALESCE(SUM(s.paid), 0) AS total_paid,
                       COALESCE(SUM(s.total - s.paid), 0) AS total_balance,
                       COUNT(s.id) AS invoice_count
                FROM sales s""" + filter.where(),
                (rs, rowNum) -> ReportStats.builder()
                        .totalSales(Decimals.fromDb(rs.getDouble("total_sales")))
                        .totalPaid(Decimals.fromDb(rs.getDouble("total_paid")))
                        .totalBalance(Decimals.fromDb(rs.getDouble("total_balance")))
                        .invoiceCount(rs.getLong("invoice_count"))
                        .build(),
                filter.args());
        if (stats == null) {
            stats = ReportStats.builder().build();
        }
        MethodTotals methods = new MethodTotals();
        jdbcTemplate.query("SELECT p.method, COALESCE(SUM(p.amount), 0) AS " + ALIAS_AMOUNT
                        + " FROM payments p JOIN sales s ON s.id = p.sale_id" + filter.where()
                        + " GROUP BY p.method",
                rs -> {
                    methods.add(rs.getString("method"), Decimals.fromDb(rs.getDouble(ALIAS_AMOUNT)));
                }, filter.args());
        stats.setCashSales(methods.cash);
        stats.setCreditSales(methods.credit);
        stats.setMobileSales(methods.mobile);
        stats.setCardSales(methods.card);
        log.debug("Stats for {} (actor={}): {} invoices", period, createdBy, stats.getInvoiceCount());
        return stats;
    }

    public BigDecimal cashTotalForUser(ReportPeriod period, String username) {
        if (!StringUtils.hasText(username)) {
            return BigDecimal.ZERO;
        }
        SqlFilter filter = scoped(period, username.trim()).and(SqlFilter.equalTo("p.method", PaymentMethods.CASH));
        Double total = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(p.amount), 0) FROM payments p JOIN sales s ON s.id = p.sale_id" + filter.where(),
                Double.class, filter.args());
        return total == null ? BigDecimal.ZERO : Decimals.fromDb(total);
    }

    /**
     * Month total split into "cash" (fully paid sales with at least one CASH payment) and
     * "credit" (everything else). Partially paid and non-cash sales all land in credit.
     */
    public MonthlyStats monthlyStats() {
        SqlFilter month = ReportPeriod.THIS_MONTH.on(SALE_TIME);
        Double total = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(s.total), 0) FROM sales s" + month.where(), Double.class, month.args());
        SqlFilter fullyPaidCash = SqlFilter.of(
                "s.paid >= s.total AND EXISTS (SELECT 1 FROM payments p WHERE p.sale_id = s.id AND p.method = ?)",
                PaymentMethods.CASH).and(month);
        Double cash = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(s.total), 0) FROM sales s" + fullyPaidCash.where(), Double.class,
                fullyPaidCash.args());
        BigDecimal totalSales = total == null ? BigDecimal.ZERO : Decimals.fromDb(total);
        BigDecimal cashSales = cash == null ? BigDecimal.ZERO : Decimals.fromDb(cash);
        return new MonthlyStats(totalSales, cashSales, totalSales.subtract(cashSales));
    }

    /** Current month, one row per method seen, largest amount first. */
    public List<PaymentMethodTotal> paymentMethodSummary() {
        SqlFilter month = ReportPeriod.THIS_MONTH.on(SALE_TIME);
        return jdbcTemplate.query("SELECT p.method, COALESCE(SUM(p.amount), 0) AS " + ALIAS_AMOUNT
                        + ", COUNT(p.id) AS payment_count"
                        + " FROM payments p JOIN sales s ON s.id = p.sale_id" + month.where()
                        + " GROUP BY p.method ORDER BY " + ALIAS_AMOUNT + " DESC",
                (rs, rowNum) -> new PaymentMethodTotal(
                        rs.getString("method"),
                        Decimals.fromDb(rs.getDouble(ALIAS_AMOUNT)),
                        rs.getLong("payment_count")),
                month.args());
    }

    public List<UserSalesSummary> userSalesSummaries(ReportPeriod period) {
        SqlFilter filter = scoped(period, null);
        Map<String, UserSalesSummary> byActor = new LinkedHashMap<>();
        jdbcTemplate.query("""
                SELECT s.created_by AS username,
                       COALESCE(u.display_name, s.created_by) AS display_name,
                       COALESCE(SUM(s.total), 0) AS total_sales,
                       COALESCE(SUM(s.paid), 0) AS total_paid,
                       COALESCE(SUM(s.total - s.paid), 0) AS total_balance,
                       COUNT(s.id) AS invoice_count
                FROM sales s
                LEFT JOIN users u ON u.username = s.created_by""" + filter.where()
                + " GROUP BY s.created_by ORDER BY total_sales DESC",
                rs -> {
                    String username = rs.getString("username");
                    byActor.put(username, UserSalesSummary.builder()
                            .username(username)
                            .displayName(rs.getString("display_name"))
                            .totalSales(Decimals.fromDb(rs.getDouble("total_sales")))
                            .totalPaid(Decimals.fromDb(rs.getDouble("total_paid")))
                            .totalBalance(Decimals.fromDb(rs.getDouble("total_balance")))
                            .invoiceCount(rs.getLong("invoice_count"))
                            .build());
                }, filter.args());

        Map<String, MethodTotals> methods = new HashMap<>();
        jdbcTemplate.query("SELECT s.created_by AS username, p.method, COALESCE(SUM(p.amount), 0) AS " + ALIAS_AMOUNT
                        + " FROM payments p JOIN sales s ON s.id = p.sale_id" + filter.where()
                        + " GROUP BY s.created_by, p.method",
                rs -> {
                    methods.computeIfAbsent(rs.getString("username"), k -> new MethodTotals())
                            .add(rs.getString("method"), Decimals.fromDb(rs.getDouble(ALIAS_AMOUNT)));
                }, filter.args());

        List<UserSalesSummary> out = new ArrayList<>(byActor.size());
        for (UserSalesSummary summary : byActor.values()) {
            MethodTotals m = methods.get(summary.getUsername());
            if (m != null) {
                summary.setCashSales(m.cash);
                summary.setCreditSales(m.credit);
                summary.setMobileSales(m.mobile);
                summary.setCardSales(m.card);
            }
            out.add(summary);
        }
        return out;
    }

    private List<SaleSummary> listSales(SqlFilter filter, Integer limit) {
        String sql = SUMMARY_SELECT + filter.where().trim() + " ORDER BY s.created_at DESC, s.id DESC";
        if (limit == null) {
            return jdbcTemplate.query(sql, SUMMARY_MAPPER, filter.args());
        }
        return jdbcTemplate.query(sql + " LIMIT ?", SUMMARY_MAPPER, filter.argsWith(limit));
    }

    private static SqlFilter scoped(ReportPeriod period, String createdBy) {
        ReportPeriod effective = period == null ? ReportPeriod.ALL : period;
        return effective.on(SALE_TIME).and(SqlFilter.equalTo(SALE_ACTOR, createdBy));
    }

    /** Sums per known payment method; unknown methods are ignored. */
    private static final class MethodTotals {
        private BigDecimal cash = BigDecimal.ZERO;
        private BigDecimal credit = BigDecimal.ZERO;
        private BigDecimal mobile = BigDecimal.ZERO;
        private BigDecimal card = BigDecimal.ZERO;

        void add(String method, BigDecimal amount) {
            if (method == null) {
                return;
            }
            switch (method) {
                case PaymentMethods.CASH -> cash = cash.add(amount);
                case PaymentMethods.CREDIT -> credit = credit.add(amount);
                case PaymentMethods.MOBILE_BANKING -> mobile = mobile.add(amount);
                case PaymentMethods.CARD -> card = card.add(amount);
                default -> {
                    // reported only by paymentMethodSummary
                }
            }
        }
    }
}
