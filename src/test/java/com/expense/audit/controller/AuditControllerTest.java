package com.expense.audit.controller;

import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.BenfordDigitStat;
import com.expense.audit.model.BenfordReport;
import com.expense.audit.model.BenfordResult;
import com.expense.audit.model.DatasetSummary;
import com.expense.audit.model.Finding;
import com.expense.audit.model.FindingReason;
import com.expense.audit.service.AuditService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.expense.audit.testutil.TestDataFactory.createExpense;
import static com.expense.audit.testutil.TestDataFactory.createInvoice;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditController.class)
class AuditControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuditService auditService;

    @Test
    void getSummary_success() throws Exception {
        when(auditService.summarize()).thenReturn(DatasetSummary.builder()
                .totalRows(3)
                .totalAmount("$1,250.50")
                .dateRange("2024-03-01 to 2024-03-12")
                .build());

        mockMvc.perform(get("/api/v1/audit/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRows").value(3))
                .andExpect(jsonPath("$.totalAmount").value("$1,250.50"))
                .andExpect(jsonPath("$.dateRange").value("2024-03-01 to 2024-03-12"));
    }

    @Test
    void findDuplicates_rowsAreFlattened() throws Exception {
        Finding finding = Finding.builder()
                .record(createInvoice("Acme", "INV-1", "100.00"))
                .reason(FindingReason.DUPLICATE)
                .dupCount(2)
                .build();
        when(auditService.runCheck(AuditCheck.DUPLICATES)).thenReturn(List.of(finding));

        mockMvc.perform(get("/api/v1/audit/duplicates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].merchant").value("Acme"))
                .andExpect(jsonPath("$[0]._reason").value("duplicate"))
                .andExpect(jsonPath("$[0]._dup_count").value(2))
                .andExpect(jsonPath("$[0]._details").doesNotExist());
    }

    @Test
    void flagWeekends_emptyResult() throws Exception {
        when(auditService.runCheck(AuditCheck.WEEKENDS)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/audit/weekends"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
    }

    @Test
    void flagThreshold_passesOverrides() throws Exception {
        when(auditService.flagThreshold(any(), any())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/audit/threshold").param("limit", "1000").param("buffer", "0"))
                .andExpect(status().isOk());

        verify(auditService).flagThreshold(new BigDecimal("1000"), new BigDecimal("0"));
    }

    @Test
    void flagThreshold_noParams_passesNulls() throws Exception {
        when(auditService.flagThreshold(isNull(), isNull())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/audit/threshold"))
                .andExpect(status().isOk());
    }

    @Test
    void flagThreshold_nonNumericLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/audit/threshold").param("limit", "lots"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void analyzeBenford_report() throws Exception {
        BenfordReport report = BenfordReport.builder()
                .totalAnalyzed(10)
                .stat(BenfordDigitStat.builder().digit(1).actualCount(10)
                        .actualPct(100.0).expectedPct(30.10).diffPct(69.90).build())
                .suspicious(true)
                .maxDeviationPct(69.90)
                .build();
        when(auditService.analyzeBenford()).thenReturn(BenfordResult.of(report));

        mockMvc.perform(get("/api/v1/audit/benford"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_analyzed").value(10))
                .andExpect(jsonPath("$.is_suspicious").value(true))
                .andExpect(jsonPath("$.stats[0].digit").value(1))
                .andExpect(jsonPath("$.stats[0].expected_pct").value(30.10))
                .andExpect(jsonPath("$.stats[0].actual_count").value(10))
                .andExpect(jsonPath("$.max_deviation_pct").value(69.90))
                .andExpect(jsonPath("$.totalAnalyzed").doesNotExist());
    }

    @Test
    void analyzeBenford_noData_returnsErrorBody() throws Exception {
        when(auditService.analyzeBenford()).thenReturn(BenfordResult.insufficientData("No valid amounts found"));

        mockMvc.perform(get("/api/v1/audit/benford"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error").value("No valid amounts found"));
    }

    @Test
    void flagSuspiciousKeywords_includesDetails() throws Exception {
        Finding finding = Finding.builder()
                .record(createExpense("E-1"))
                .reason(FindingReason.SUSPICIOUS_KEYWORD)
                .details("merchant:casino")
                .build();
        when(auditService.runCheck(AuditCheck.SUSPICIOUS_KEYWORDS)).thenReturn(List.of(finding));

        mockMvc.perform(get("/api/v1/audit/suspicious"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].expense_id").value("E-1"))
                .andExpect(jsonPath("$[0]._reason").value("suspicious_keyword"))
                .andExpect(jsonPath("$[0]._details").value("merchant:casino"));
    }

    @Test
    void flagDiscrepancies_success() throws Exception {
        Finding finding = Finding.builder()
                .record(createExpense("E-2"))
                .reason(FindingReason.DISCREPANCY)
                .details("Diff: $5.00")
                .build();
        when(auditService.runCheck(AuditCheck.PAYMENT_DISCREPANCIES)).thenReturn(List.of(finding));

        mockMvc.perform(get("/api/v1/audit/discrepancies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]._details").value("Diff: $5.00"));
    }

    @Test
    void download_returnsCsvAttachment() throws Exception {
        byte[] csv = "\uFEFFexpense_id\nE-1\n".getBytes(StandardCharsets.UTF_8);
        when(auditService.exportLastResults()).thenReturn(csv);

        mockMvc.perform(get("/api/v1/audit/download"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", containsString("text/csv")))
                .andExpect(header().string("Content-Disposition",
                        containsString("filename=\"expenses_audit_results.csv\"")))
                .andExpect(content().bytes(csv));
    }
}
