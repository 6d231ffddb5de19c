package com.github.spud.sample.ai.finance.domain.data;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of one household's finances. There is no write operation here;
 * every capability an agent can reach goes through this port.
 * <p>
 * Amounts are rounded to two decimals. Expense aggregations other than
 * {@link #getSpendingSummary} only count active expenses.
 */
public interface FinanceDataAccess {

  DatabaseSchema getDatabaseSchema();

  Optional<UserProfile> getUserProfile(long userId);

  /**
   * @param start inclusive lower bound, or {@code null} for open
   * @param end inclusive upper bound, or {@code null} for open
   * @throws FinanceDataAccessException when {@code start} is after {@code end}
   */
  SpendingSummary getSpendingSummary(long userId, LocalDate start, LocalDate end);

  List<CategoryTotal> getCategoryBreakdown(long userId, LocalDate start, LocalDate end);

  /**
   * @param categoryName restricts to one category, or {@code null} for all
   */
  List<SubcategoryTotal> getSubcategoryBreakdown(long userId, String categoryName);

  List<AccountTotal> getAccountSummary(long userId);

  /**
   * The most recent {@code months} months that have expenses, oldest first
   */
  List<MonthlyTrend> getMonthlyTrends(long userId, int months);

  SavingsSummary getSavingsSummary(long userId);

  CurrentIncomeSources getCurrentIncomeSources(long userId);

  /**
   * @param month the month to summarise, or {@code null} for the current month
   */
  IncomeSummary getIncomeSummary(long userId, YearMonth month);

  List<ExpenseTemplate> getExpenseTemplates(long userId);

  FinancialHealthMetrics getFinancialHealthMetrics(long userId);

  record DatabaseSchema(Map<String, TableInfo> tables) {

  }

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  record TableInfo(String description, List<String> columns, List<String> relationships,
                   List<String> types) {

  }

  record UserProfile(long userId, String email, String fullName, String currency,
                     String timezone, HouseholdInfo householdInfo, FinancialGoals financialGoals,
                     String accountCreated, String note) {

  }

  record HouseholdInfo(Integer householdMembers, Integer numVehicles, String housingType,
                       BigDecimal houseSizeSqm) {

  }

  record FinancialGoals(BigDecimal monthlyIncomeGoal, BigDecimal monthlySavingsGoal) {

  }

  record SpendingSummary(int totalExpenses, BigDecimal totalAmount, int activeExpenses,
                         BigDecimal activeAmount, DateRange dateRange) {

  }

  record DateRange(LocalDate start, LocalDate end) {

  }

  record CategoryTotal(String category, BigDecimal totalAmount, long count) {

  }

  record SubcategoryTotal(String category, String subcategory, BigDecimal totalAmount,
                          long count) {

  }

  record AccountTotal(String accountName, String ownerName, BigDecimal totalAmount,
                      long expenseCount) {

  }

  record MonthlyTrend(int year, int month, BigDecimal totalAmount, long expenseCount) {

  }

  record SavingsSummary(int totalAccounts, BigDecimal totalDeposits, BigDecimal totalWithdrawals,
                        List<SavingsAccountSummary> accounts) {

  }

  record SavingsAccountSummary(String accountName, String accountType, BigDecimal totalDeposits,
                               BigDecimal totalWithdrawals, BigDecimal netDeposits,
                               BigDecimal currentValue, BigDecimal profitLoss,
                               BigDecimal profitLossPercentage) {

  }

  record CurrentIncomeSources(BigDecimal totalCurrentMonthlyIncome, List<IncomeSource> incomeSources,
                              String note) {

  }

  record IncomeSource(String sourceName, BigDecimal currentAmount) {

  }

  record IncomeSummary(BigDecimal totalIncome, BigDecimal recurringIncome,
                       BigDecimal oneTimeIncome, int incomeCount, List<SourceAmount> sources,
                       String month, String note) {

  }

  record SourceAmount(String source, BigDecimal amount) {

  }

  record ExpenseTemplate(String name, BigDecimal amount, String category, String subcategory) {

  }

  record FinancialHealthMetrics(BigDecimal monthlyIncome, BigDecimal monthlyExpenses,
                                BigDecimal monthlySavings, BigDecimal savingsRatePercentage,
                                BigDecimal totalSavingsValue, BigDecimal incomeGoal,
                                BigDecimal savingsGoal, String currency) {

  }
}
