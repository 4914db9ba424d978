package com.expense.audit.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure.
 * Ensures all endpoints and critical schemas are present,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Audit endpoints
        assertThat(paths).containsKey("/api/v1/audit/summary");
        assertThat(paths).containsKey("/api/v1/audit/duplicates");
        assertThat(paths).containsKey("/api/v1/audit/weekends");
        assertThat(paths).containsKey("/api/v1/audit/threshold");
        assertThat(paths).containsKey("/api/v1/audit/benford");
        assertThat(paths).containsKey("/api/v1/audit/suspicious");
        assertThat(paths).containsKey("/api/v1/audit/discrepancies");
        assertThat(paths).containsKey("/api/v1/audit/download");

        // Expense record endpoints
        assertThat(paths).containsKey("/api/v1/expenses");
        assertThat(paths).containsKey("/api/v1/expenses/{expenseId}");

        // Config endpoint
        assertThat(paths).containsKey("/api/v1/config/audit");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("DatasetSummary");
        assertThat(schemas).containsKey("BenfordReport");
        assertThat(schemas).containsKey("BenfordDigitStat");
    }

    @Test
    void openApiSpec_benfordSchema_hasRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> reportProps = json.read("$.components.schemas.BenfordReport.properties");
        assertThat(reportProps).containsKey("total_analyzed");
        assertThat(reportProps).containsKey("stats");
        assertThat(reportProps).containsKey("is_suspicious");
        assertThat(reportProps).containsKey("max_deviation_pct");

        Map<String, Object> statProps = json.read("$.components.schemas.BenfordDigitStat.properties");
        assertThat(statProps).containsKey("digit");
        assertThat(statProps).containsKey("actual_pct");
        assertThat(statProps).containsKey("expected_pct");
        assertThat(statProps).containsKey("diff_pct");
    }
}
