package com.flagship.invoice_followup.template;

import com.flagship.invoice_followup.invoice.Invoice;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

/**
 * Values available to template placeholders. Any field may be null; a null renders as
 * the empty string.
 */
@Value
@Builder
public class RenderContext {
    String companyName;
    String customerName;
    String invoiceNumber;
    BigDecimal amount;
    String currency;
    LocalDate dueDate;
    LocalDate today;

    public static RenderContext of(Invoice invoice, String companyName, LocalDate today) {
        return RenderContext.builder()
            .companyName(companyName)
            .customerName(invoice.getCustomerName())
            .invoiceNumber(invoice.getExternalInvoiceId())
            .amount(invoice.getAmount())
            .currency(invoice.getCurrency())
            .dueDate(invoice.getDueDate())
            .today(today)
            .build();
    }

    /**
     * Placeholder name to rendered value. Absent entries render as "".
     */
    Map<String, String> variables() {
        Map<String, String> vars = new HashMap<>();
        putIfPresent(vars, "company_name", companyName);
        putIfPresent(vars, "customer_name", customerName);
        putIfPresent(vars, "invoice_number", invoiceNumber);
        if (amount != null) {
            vars.put("amount", amount.setScale(2, RoundingMode.HALF_UP).toPlainString());
        }
        putIfPresent(vars, "currency", currency);
        if (dueDate != null) {
            vars.put("due_date", dueDate.toString());
            if (today != null) {
                long overdue = ChronoUnit.DAYS.between(dueDate, today);
                vars.put("days_overdue", String.valueOf(Math.max(0, overdue)));
            }
        }
        return vars;
    }

    private static void putIfPresent(Map<String, String> vars, String key, String value) {
        if (value != null) {
            vars.put(key, value);
        }
    }
}
