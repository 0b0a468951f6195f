package com.example.pos.report;

import com.example.pos.StoreTestSupport;
import com.example.pos.sale.SaleLineByCode;
import com.example.pos.sale.SaleService;
import com.example.pos.user.UserRole;
import com.example.pos.user.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SaleReportServiceTest extends StoreTestSupport {

    @Autowired
    private SaleReportService saleReportService;

    @Autowired
    private SaleService saleService;

    @Autowired
    private UserService userService;

    @BeforeEach
    void catalog() {
        product("P001", "10.0", "100");
    }

    private long sell(String qty, String paid, String method, String actor) {
        return saleService.createSaleByCode(null, List.of(new SaleLineByCode("P001", new BigDecimal(qty))),
                new BigDecimal(paid), method, actor);
    }

    @Test
    void emptyStoreGivesZeroStats() {
        ReportStats stats = saleReportService.getStatsForPeriod(ReportPeriod.fromLabel("Today"), null);

        assertThat(stats.getInvoiceCount()).isZero();
        assertThat(stats.getTotalSales()).isEqualByComparingTo("0");
        assertThat(stats.getTotalPaid()).isEqualByComparingTo("0");
        assertThat(stats.getTotalBalance()).isEqualByComparingTo("0");
        assertThat(stats.getCashSales()).isEqualByComparingTo("0");
        assertThat(stats.getCreditSales()).isEqualByComparingTo("0");
        assertThat(stats.getMobileSales()).isEqualByComparingTo("0");
        assertThat(stats.getCardSales()).isEqualByComparingTo("0");
        assertThat(saleReportService.monthlyStats().getTotalSales()).isEqualByComparingTo("0");
        assertThat(saleReportService.paymentMethodSummary()).isEmpty();
        assertThat(saleReportService.userSalesSummaries(ReportPeriod.ALL)).isEmpty();
    }

    @Test
    void statsBreakDownPaymentsByMethod() {
        sell("3", "30", "CASH", "alice");
        sell("1", "10", "MOBILE_BANKING", "alice");
        sell("2", "20", "CARD", "bob");
        sell("1", "4", "VOUCHER", "bob");

        ReportStats stats = saleReportService.getStatsForPeriod(ReportPeriod.THIS_MONTH, null);

        assertThat(stats.getInvoiceCount()).isEqualTo(4);
        assertThat(stats.getTotalSales()).isEqualByComparingTo("70");
        assertThat(stats.getTotalPaid()).isEqualByComparingTo("64");
        assertThat(stats.getTotalBalance()).isEqualByComparingTo("6");
        assertThat(stats.getCashSales()).isEqualByComparingTo("30");
        assertThat(stats.getMobileSales()).isEqualByComparingTo("10");
        assertThat(stats.getCardSales()).isEqualByComparingTo("20");
        assertThat(stats.getCreditSales()).isEqualByComparingTo("0");

        ReportStats bobOnly = saleReportService.getStatsForPeriod(ReportPeriod.TODAY, "bob");
        assertThat(bobOnly.getInvoiceCount()).isEqualTo(2);
        assertThat(bobOnly.getCashSales()).isEqualByComparingTo("0");
        assertThat(bobOnly.getCardSales()).isEqualByComparingTo("20");
    }

    @Test
    void salesListsAreScopedToTheActor() {
        sell("1", "10", "CASH", "alice");
        sell("2", "20", "CASH", "bob");

        assertThat(saleReportService.dailySales(null)).hasSize(2);
        assertThat(saleReportService.monthlySales("alice"))
                .extracting(SaleSummary::getCreatedBy)
                .containsExactly("alice");
        assertThat(saleReportService.allSales(null, "nobody")).isEmpty();
    }

    @Test
    void allSalesHonoursLimitNewestFirst() {
        long first = sell("1", "10", "CASH", "alice");
        long second = sell("1", "10", "CASH", "alice");

        List<SaleSummary> latest = saleReportService.allSales(1, null);

        assertThat(latest).extracting(SaleSummary::getId).containsExactly(second);
        assertThat(saleReportService.allSales(null, null)).extracting(SaleSummary::getId)
                .containsExactly(second, first);
    }

    @Test
    void dateRangeIsInclusiveAndUnscoped() {
        sell("1", "10", "CASH", "alice");
        sell("1", "10", "CASH", "bob");
        LocalDate today = LocalDate.now(ZoneOffset.UTC);

        assertThat(saleReportService.salesByDateRange(today, today)).hasSize(2);
        assertThat(saleReportService.salesByDateRange(today.minusDays(7), today.minusDays(1))).isEmpty();
    }

    @Test
    void cashTotalForUserCountsOnlyThatActorsCash() {
        sell("3", "30", "CASH", "alice");
        sell("1", "10", "CARD", "alice");
        sell("2", "20", "CASH", "bob");

        assertThat(saleReportService.cashTotalForUser(ReportPeriod.TODAY, "alice")).isEqualByComparingTo("30");
        assertThat(saleReportService.cashTotalForUser(ReportPeriod.ALL, "bob")).isEqualByComparingTo("20");
        assertThat(saleReportService.cashTotalForUser(ReportPeriod.TODAY, "  ")).isEqualByComparingTo("0");
        assertThat(saleReportService.cashTotalForUser(ReportPeriod.TODAY, null)).isEqualByComparingTo("0");
    }

    @Test
    void monthlyCashCountsOnlyFullyPaidSalesWithCash() {
        sell("2", "20", "CASH", "alice");
        sell("1", "5", "CASH", "alice");
        sell("1", "10", "CARD", "alice");

        MonthlyStats monthly = saleReportService.monthlyStats();

        assertThat(monthly.getTotalSales()).isEqualByComparingTo("40");
        assertThat(monthly.getCashSales()).isEqualByComparingTo("20");
        assertThat(monthly.getCreditSales()).isEqualByComparingTo("20");
    }

    @Test
    void paymentMethodSummaryOrdersByAmount() {
        sell("1", "10", "CASH", "alice");
        sell("1", "10", "CASH", "alice");
        sell("3", "30", "CARD", "bob");

        List<PaymentMethodTotal> summary = saleReportService.paymentMethodSummary();

        assertThat(summary).extracting(PaymentMethodTotal::getMethod).containsExactly("CARD", "CASH");
        assertThat(summary.get(0).getTotalAmount()).isEqualByComparingTo("30");
        assertThat(summary.get(0).getPaymentCount()).isEqualTo(1);
        assertThat(summary.get(1).getTotalAmount()).isEqualByComparingTo("20");
        assertThat(summary.get(1).getPaymentCount()).isEqualTo(2);
    }

    @Test
    void userSummariesOneRowPerActorSortedByTotal() {
        userService.saveUser("alice", "Alice Atkins", UserRole.CASHIER, "pw-alice");
        sell("1", "10", "CARD", "alice");
        sell("2", "20", "CASH", "bob");
        sell("2", "20", "CASH", "alice");

        List<UserSalesSummary> rows = saleReportService.userSalesSummaries(ReportPeriod.fromLabel("Today"));

        assertThat(rows).hasSize(2);
        UserSalesSummary top = rows.get(0);
        assertThat(top.getUsername()).isEqualTo("alice");
        assertThat(top.getDisplayName()).isEqualTo("Alice Atkins");
        assertThat(top.getTotalSales()).isEqualByComparingTo("30");
        assertThat(top.getInvoiceCount()).isEqualTo(2);
        assertThat(top.getCashSales()).isEqualByComparingTo("20");
        assertThat(top.getCardSales()).isEqualByComparingTo("10");

        UserSalesSummary second = rows.get(1);
        assertThat(second.getUsername()).isEqualTo("bob");
        assertThat(second.getDisplayName()).isEqualTo("bob");
        assertThat(second.getTotalSales()).isEqualByComparingTo("20");
        assertThat(second.getCashSales()).isEqualByComparingTo("20");
        assertThat(second.getCardSales()).isEqualByComparingTo("0");
    }

    @Test
    void mixedCaseActorIsStoredLowerCasedAndJoinsItsUser() {
        userService.saveUser("alice", "Alice Atkins", UserRole.CASHIER, "pw-alice");
        sell("1", "10", "CASH", "  Alice ");

        List<UserSalesSummary> rows = saleReportService.userSalesSummaries(ReportPeriod.ALL);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getUsername()).isEqualTo("alice");
        assertThat(rows.get(0).getDisplayName()).isEqualTo("Alice Atkins");
        assertThat(saleReportService.dailySales("alice")).hasSize(1);
        assertThat(saleReportService.cashTotalForUser(ReportPeriod.ALL, "alice")).isEqualByComparingTo("10");
    }
}
