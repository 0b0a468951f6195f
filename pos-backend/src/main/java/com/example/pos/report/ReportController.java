package com.example.pos.report;

import com.example.pos.security.CurrentActor;
import com.example.pos.utils.Decimals;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final SaleReportService saleReportService;

    @GetMapping("/sales")
    public List<SaleSummary> sales(@RequestParam(name = "filter", defaultValue = "today") String filter,
            @RequestParam(name = "limit", required = false) Integer limit,
            HttpServletRequest request) {
        String scope = CurrentActor.reportScope(request);
        return switch (filter.trim().toLowerCase()) {
            case "month" -> saleReportService.monthlySales(scope);
            case "all" -> saleReportService.allSales(limit, scope);
            default -> saleReportService.dailySales(scope);
        };
    }

    @GetMapping("/sales/range")
    public List<SaleSummary> salesByRange(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return saleReportService.salesByDateRange(start, end);
    }

    @GetMapping("/stats")
    public ReportStats stats(@RequestParam(name = "period", required = false) String period,
            HttpServletRequest request) {
        return saleReportService.getStatsForPeriod(ReportPeriod.fromLabel(period), CurrentActor.reportScope(request));
    }

    @GetMapping("/cash")
    public Map<String, Object> cash(@RequestParam(name = "period", required = false) String period,
            HttpServletRequest request) {
        ReportPeriod p = ReportPeriod.fromLabel(period);
        String username = CurrentActor.username(request);
        BigDecimal total = saleReportService.cashTotalForUser(p, username);
        return Map.of("username", username == null ? "" : username, "period", p.getLabel(),
                "cash_total", Decimals.forDisplay(total));
    }

    @GetMapping("/monthly")
    public MonthlyStats monthly() {
        return saleReportService.monthlyStats();
    }

    @GetMapping("/payment-methods")
    public List<PaymentMethodTotal> paymentMethods() {
        return saleReportService.paymentMethodSummary();
    }

    @GetMapping("/users")
    public List<UserSalesSummary> users(@RequestParam(name = "period", required = false) String period) {
        return saleReportService.userSalesSummaries(ReportPeriod.fromLabel(period));
    }
}
