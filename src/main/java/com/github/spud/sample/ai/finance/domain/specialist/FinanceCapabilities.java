package com.github.spud.sample.ai.finance.domain.specialist;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess;
import com.github.spud.sample.ai.finance.domain.tools.CapabilityException;
import com.github.spud.sample.ai.finance.domain.tools.CapabilityToolCallback;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * Read-only finance capabilities, bound to one user at a time. Each specialist gets a fixed
 * subset of them.
 */
@Component
@RequiredArgsConstructor
public class FinanceCapabilities {

  public static final List<String> ANALYTICS_CAPABILITIES = List.of(
    "get_database_schema",
    "get_user_profile",
    "get_spending_summary",
    "get_category_breakdown",
    "get_subcategory_breakdown",
    "get_account_summary",
    "get_monthly_trends",
    "get_savings_summary",
    "get_current_income_sources",
    "get_income_summary",
    "get_expense_templates");

  public static final List<String> ADVISOR_CAPABILITIES = List.of(
    "get_user_profile",
    "get_financial_health_metrics",
    "get_category_breakdown",
    "get_monthly_trends",
    "get_savings_summary",
    "get_current_income_sources",
    "get_income_summary",
    "get_expense_templates",
    "get_spending_summary");

  private static final int DEFAULT_TREND_MONTHS = 6;

  private final FinanceDataAccess financeDataAccess;

  private final Validator validator;

  public List<ToolCallback> analyticsCapabilities(long userId) {
    return select(userId, ANALYTICS_CAPABILITIES);
  }

  public List<ToolCallback> advisorCapabilities(long userId) {
    return select(userId, ADVISOR_CAPABILITIES);
  }

  private List<ToolCallback> select(long userId, List<String> names) {
    Map<String, ToolCallback> all = capabilities(userId);
    return names.stream()
      .map(name -> {
        ToolCallback callback = all.get(name);
        if (callback == null) {
          throw new IllegalStateException("No capability named " + name);
        }
        return callback;
      })
      .toList();
  }

  private Map<String, ToolCallback> capabilities(long userId) {
    Map<String, ToolCallback> table = new LinkedHashMap<>();

    register(table, "get_database_schema",
      "Get complete database schema information including all tables and columns",
      NoArguments.class,
      args -> financeDataAccess.getDatabaseSchema());

    register(table, "get_user_profile",
      "Get user's profile including financial goals and household information",
      NoArguments.class,
      args -> financeDataAccess.getUserProfile(userId)
        .<Object>map(profile -> profile)
        .orElseGet(Map::of));

    register(table, "get_spending_summary",
      "Get spending summary for a date range",
      DateRangeArguments.class,
      args -> financeDataAccess.getSpendingSummary(userId,
        parseDate(args.startDate()), parseDate(args.endDate())));

    register(table, "get_category_breakdown",
      "Get spending breakdown by category for a date range",
      DateRangeArguments.class,
      args -> financeDataAccess.getCategoryBreakdown(userId,
        parseDate(args.startDate()), parseDate(args.endDate())));

    register(table, "get_subcategory_breakdown",
      "Get spending breakdown by subcategory, optionally filtered by category",
      CategoryArguments.class,
      args -> financeDataAccess.getSubcategoryBreakdown(userId, args.categoryName()));

    register(table, "get_account_summary",
      "Get spending summary by payment account",
      NoArguments.class,
      args -> financeDataAccess.getAccountSummary(userId));

    register(table, "get_monthly_trends",
      "Get monthly spending trends for the last N months",
      MonthsArguments.class,
      args -> financeDataAccess.getMonthlyTrends(userId,
        args.months() != null ? args.months() : DEFAULT_TREND_MONTHS));

    register(table, "get_savings_summary",
      "Get complete savings and investment summary with profit/loss",
      NoArguments.class,
      args -> financeDataAccess.getSavingsSummary(userId));

    register(table, "get_current_income_sources",
      "Get CURRENT recurring monthly income sources and amounts (NOT historical totals). "
        + "Use this when user asks about 'current income' or 'monthly income'.",
      NoArguments.class,
      args -> financeDataAccess.getCurrentIncomeSources(userId));

    register(table, "get_income_summary",
      "Get income summary for a SPECIFIC month (YYYY-MM format). "
        + "Use this for historical income analysis, NOT for current income.",
      MonthArguments.class,
      args -> financeDataAccess.getIncomeSummary(userId, parseMonth(args.month())));

    register(table, "get_expense_templates",
      "Get all recurring expense templates",
      NoArguments.class,
      args -> financeDataAccess.getExpenseTemplates(userId));

    register(table, "get_financial_health_metrics",
      "Calculate overall financial health metrics including savings rate and income vs expenses",
      NoArguments.class,
      args -> financeDataAccess.getFinancialHealthMetrics(userId));

    return table;
  }

  private <I> void register(Map<String, ToolCallback> table, String name, String description,
    Class<I> argumentType, Function<I, Object> handler) {
    table.put(name, CapabilityToolCallback.of(name, description, argumentType, validator, handler));
  }

  private static LocalDate parseDate(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      throw new CapabilityException("Invalid date '" + value + "', expected YYYY-MM-DD", e);
    }
  }

  private static YearMonth parseMonth(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return YearMonth.parse(value);
    } catch (DateTimeParseException e) {
      throw new CapabilityException("Invalid month '" + value + "', expected YYYY-MM", e);
    }
  }

  public record NoArguments() {

  }

  public record DateRangeArguments(
    @JsonProperty("start_date")
    @ToolParam(description = "Start date in YYYY-MM-DD format (optional)", required = false)
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "must be in YYYY-MM-DD format")
    String startDate,

    @JsonProperty("end_date")
    @ToolParam(description = "End date in YYYY-MM-DD format (optional)", required = false)
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "must be in YYYY-MM-DD format")
    String endDate) {

  }

  public record CategoryArguments(
    @JsonProperty("category_name")
    @ToolParam(description = "Filter by specific category name (optional)", required = false)
    String categoryName) {

  }

  public record MonthsArguments(
    @JsonProperty("months")
    @ToolParam(description = "Number of months to retrieve (default: 6)", required = false)
    @Min(1) @Max(24)
    Integer months) {

  }

  public record MonthArguments(
    @JsonProperty("month")
    @ToolParam(description = "Month in YYYY-MM format (optional, defaults to current month)",
      required = false)
    @Pattern(regexp = "\\d{4}-\\d{2}", message = "must be in YYYY-MM format")
    String month) {

  }
}
