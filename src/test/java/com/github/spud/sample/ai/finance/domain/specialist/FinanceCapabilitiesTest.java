package com.github.spud.sample.ai.finance.domain.specialist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.DateRange;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.MonthlyTrend;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.SpendingSummary;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccessException;
import com.github.spud.sample.ai.finance.domain.tools.CapabilityException;
import com.github.spud.sample.ai.finance.domain.tools.ToolRegistry;
import com.github.spud.sample.ai.finance.util.JsonUtils;
import jakarta.validation.Validation;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.tool.ToolCallback;

@ExtendWith(MockitoExtension.class)
class FinanceCapabilitiesTest {

  @Mock
  private FinanceDataAccess financeDataAccess;

  private ToolRegistry analytics;

  private ToolRegistry advisor;

  @BeforeEach
  void setUp() {
    FinanceCapabilities capabilities = new FinanceCapabilities(financeDataAccess,
      Validation.buildDefaultValidatorFactory().getValidator());
    analytics = ToolRegistry.of(capabilities.analyticsCapabilities(1L));
    advisor = ToolRegistry.of(capabilities.advisorCapabilities(1L));
  }

  private static ToolCallback tool(ToolRegistry registry, String name) {
    return registry.getCallback(name).orElseThrow();
  }

  @Test
  @DisplayName("Each specialist gets its own fixed capability subset")
  void shouldExposeCapabilitySubsets() {
    assertThat(analytics.getToolNames())
      .containsExactlyElementsOf(FinanceCapabilities.ANALYTICS_CAPABILITIES)
      .doesNotContain("get_financial_health_metrics");
    assertThat(advisor.getToolNames())
      .containsExactlyElementsOf(FinanceCapabilities.ADVISOR_CAPABILITIES)
      .doesNotContain("get_database_schema", "get_subcategory_breakdown",
        "get_account_summary");
  }

  @Test
  @DisplayName("Date arguments are parsed and the summary is returned with snake_case names")
  void shouldQuerySpendingSummary() {
    LocalDate start = LocalDate.of(2024, 2, 1);
    LocalDate end = LocalDate.of(2024, 2, 29);
    when(financeDataAccess.getSpendingSummary(1L, start, end)).thenReturn(
      new SpendingSummary(4, new BigDecimal("1850.75"), 3, new BigDecimal("1550.75"),
        new DateRange(start, end)));

    String payload = tool(analytics, "get_spending_summary")
      .call("{\"start_date\":\"2024-02-01\",\"end_date\":\"2024-02-29\"}");

    JsonNode json = JsonUtils.readTree(payload);
    assertThat(json.path("total_expenses").asInt()).isEqualTo(4);
    assertThat(json.path("active_amount").decimalValue()).isEqualByComparingTo("1550.75");
    assertThat(json.path("date_range").path("start").asText()).isEqualTo("2024-02-01");
  }

  @Test
  @DisplayName("Omitted dates mean an unbounded range")
  void shouldPassMissingDatesAsNull() {
    when(financeDataAccess.getCategoryBreakdown(1L, null, null)).thenReturn(List.of());

    assertThat(tool(advisor, "get_category_breakdown").call("{}")).isEqualTo("[]");
    verify(financeDataAccess).getCategoryBreakdown(1L, null, null);
  }

  @Test
  @DisplayName("Dates that are well formed but not real calendar dates are rejected")
  void shouldRejectImpossibleDate() {
    assertThatThrownBy(() -> tool(analytics, "get_spending_summary")
      .call("{\"start_date\":\"2024-13-01\"}"))
      .isInstanceOf(CapabilityException.class)
      .hasMessageContaining("Invalid date '2024-13-01'");
    verify(financeDataAccess, never()).getSpendingSummary(anyLong(), isNull(), isNull());
  }

  @Test
  @DisplayName("Monthly trends default to six months and reject out-of-range counts")
  void shouldDefaultAndBoundTrendMonths() {
    when(financeDataAccess.getMonthlyTrends(1L, 6)).thenReturn(List.of(
      new MonthlyTrend(2024, 3, new BigDecimal("9650.00"), 3)));

    String payload = tool(analytics, "get_monthly_trends").call("");

    assertThat(JsonUtils.readTree(payload).get(0).path("expense_count").asLong()).isEqualTo(3);
    assertThatThrownBy(() -> tool(analytics, "get_monthly_trends").call("{\"months\":25}"))
      .isInstanceOf(CapabilityException.class)
      .hasMessageContaining("months");
    verify(financeDataAccess).getMonthlyTrends(1L, 6);
    verify(financeDataAccess, never()).getMonthlyTrends(anyLong(), eq(25));
  }

  @Test
  @DisplayName("A missing user profile is reported as an empty object")
  void shouldReturnEmptyProfile() {
    when(financeDataAccess.getUserProfile(1L)).thenReturn(Optional.empty());

    assertThat(tool(analytics, "get_user_profile").call("{}")).isEqualTo("{}");
  }

  @Test
  @DisplayName("Income summary accepts an optional YYYY-MM month")
  void shouldParseIncomeMonth() {
    assertThatThrownBy(() -> tool(advisor, "get_income_summary").call("{\"month\":\"2024-3\"}"))
      .isInstanceOf(CapabilityException.class)
      .hasMessageContaining("YYYY-MM");

    tool(advisor, "get_income_summary").call("{}");
    verify(financeDataAccess).getIncomeSummary(1L, null);
  }

  @Test
  @DisplayName("Data-access failures surface to the caller of the capability")
  void shouldSurfaceDataAccessFailures() {
    when(financeDataAccess.getAccountSummary(1L))
      .thenThrow(new FinanceDataAccessException("Failed to read account summary"));

    assertThatThrownBy(() -> tool(analytics, "get_account_summary").call("{}"))
      .isInstanceOf(FinanceDataAccessException.class);
  }
}
