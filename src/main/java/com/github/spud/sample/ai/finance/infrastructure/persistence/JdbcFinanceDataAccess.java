package com.github.spud.sample.ai.finance.infrastructure.persistence;

import com.github.spud.sample.ai.finance.application.config.AgentProperties;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccessException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Read-only SQL implementation of {@link FinanceDataAccess}
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcFinanceDataAccess implements FinanceDataAccess {

  private static final DatabaseSchema SCHEMA = buildSchema();

  private static final String CURRENT_INCOME_NOTE =
    "These are CURRENT recurring income amounts, not historical totals";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  private final Clock clock;

  private final AgentProperties agentProperties;

  private static final RowMapper<CategoryTotal> CATEGORY_ROW_MAPPER = (rs, rowNum) ->
    new CategoryTotal(
      rs.getString("category_name"),
      round(rs.getBigDecimal("total_amount")),
      rs.getLong("expense_count"));

  private static final RowMapper<SubcategoryTotal> SUBCATEGORY_ROW_MAPPER = (rs, rowNum) ->
    new SubcategoryTotal(
      rs.getString("category_name"),
      rs.getString("subcategory_name"),
      round(rs.getBigDecimal("total_amount")),
      rs.getLong("expense_count"));

  private static final RowMapper<AccountTotal> ACCOUNT_ROW_MAPPER = (rs, rowNum) ->
    new AccountTotal(
      rs.getString("account_name"),
      rs.getString("owner_name"),
      round(rs.getBigDecimal("total_amount")),
      rs.getLong("expense_count"));

  private static final RowMapper<MonthlyTrend> TREND_ROW_MAPPER = (rs, rowNum) ->
    new MonthlyTrend(
      rs.getInt("yr"),
      rs.getInt("mon"),
      round(rs.getBigDecimal("total_amount")),
      rs.getLong("expense_count"));

  private static final RowMapper<ExpenseTemplate> TEMPLATE_ROW_MAPPER = (rs, rowNum) ->
    new ExpenseTemplate(
      rs.getString("name"),
      round(rs.getBigDecimal("amount")),
      rs.getString("category_name"),
      rs.getString("subcategory_name"));

  @Override
  public DatabaseSchema getDatabaseSchema() {
    return SCHEMA;
  }

  @Override
  public Optional<UserProfile> getUserProfile(long userId) {
    String sql =
      "SELECT id, email, full_name, currency, timezone, household_members, num_vehicles, " +
        "housing_type, house_size_sqm, monthly_income_goal, monthly_savings_goal, created_at " +
        "FROM users WHERE id = :userId";

    List<UserProfile> results = read("user profile", () -> jdbcTemplate.query(sql,
      userParams(userId), (rs, rowNum) -> {
        String currency = rs.getString("currency");
        if (currency == null) {
          currency = agentProperties.getDefaultCurrency();
        }
        String timezone = rs.getString("timezone");
        if (timezone == null) {
          timezone = "UTC";
        }
        String fullName = rs.getString("full_name");
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new UserProfile(
          rs.getLong("id"),
          rs.getString("email"),
          fullName,
          currency,
          timezone,
          new HouseholdInfo(
            rs.getObject("household_members", Integer.class),
            rs.getObject("num_vehicles", Integer.class),
            rs.getString("housing_type"),
            rs.getBigDecimal("house_size_sqm")),
          new FinancialGoals(
            rs.getBigDecimal("monthly_income_goal"),
            rs.getBigDecimal("monthly_savings_goal")),
          createdAt != null ? createdAt.toLocalDateTime().toString() : null,
          "Always use " + currency + " when displaying amounts. User's name is " + fullName
            + ". User's timezone is " + timezone + ".");
      }));
    return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
  }

  @Override
  public SpendingSummary getSpendingSummary(long userId, LocalDate start, LocalDate end) {
    checkRange(start, end);
    MapSqlParameterSource params = userParams(userId);
    String sql =
      "SELECT COUNT(e.id) AS expense_count, COALESCE(SUM(e.amount), 0) AS total_amount, " +
        "COALESCE(SUM(CASE WHEN e.status = TRUE THEN 1 ELSE 0 END), 0) AS active_count, " +
        "COALESCE(SUM(CASE WHEN e.status = TRUE THEN e.amount ELSE 0 END), 0) AS active_amount " +
        "FROM expenses e WHERE e.user_id = :userId" + dateFilter(params, start, end);

    return read("spending summary", () -> jdbcTemplate.queryForObject(sql, params,
      (rs, rowNum) -> new SpendingSummary(
        rs.getInt("expense_count"),
        round(rs.getBigDecimal("total_amount")),
        rs.getInt("active_count"),
        round(rs.getBigDecimal("active_amount")),
        new DateRange(start, end))));
  }

  @Override
  public List<CategoryTotal> getCategoryBreakdown(long userId, LocalDate start, LocalDate end) {
    checkRange(start, end);
    MapSqlParameterSource params = userParams(userId);
    String sql =
      "SELECT c.name AS category_name, SUM(e.amount) AS total_amount, COUNT(e.id) AS expense_count " +
        "FROM expenses e JOIN categories c ON e.category_id = c.id " +
        "WHERE e.user_id = :userId AND e.status = TRUE" + dateFilter(params, start, end) +
        " GROUP BY c.name ORDER BY total_amount DESC, c.name";

    return read("category breakdown", () -> jdbcTemplate.query(sql, params, CATEGORY_ROW_MAPPER));
  }

  @Override
  public List<SubcategoryTotal> getSubcategoryBreakdown(long userId, String categoryName) {
    MapSqlParameterSource params = userParams(userId);
    StringBuilder sql = new StringBuilder(
      "SELECT c.name AS category_name, s.name AS subcategory_name, " +
        "SUM(e.amount) AS total_amount, COUNT(e.id) AS expense_count " +
        "FROM expenses e " +
        "JOIN subcategories s ON e.subcategory_id = s.id " +
        "JOIN categories c ON e.category_id = c.id " +
        "WHERE e.user_id = :userId AND e.status = TRUE");
    if (categoryName != null) {
      sql.append(" AND c.name = :categoryName");
      params.addValue("categoryName", categoryName);
    }
    sql.append(" GROUP BY c.name, s.name ORDER BY c.name, total_amount DESC, s.name");

    return read("subcategory breakdown",
      () -> jdbcTemplate.query(sql.toString(), params, SUBCATEGORY_ROW_MAPPER));
  }

  @Override
  public List<AccountTotal> getAccountSummary(long userId) {
    String sql =
      "SELECT a.name AS account_name, a.owner_name, SUM(e.amount) AS total_amount, " +
        "COUNT(e.id) AS expense_count " +
        "FROM expenses e JOIN accounts a ON e.account_id = a.id " +
        "WHERE e.user_id = :userId AND e.status = TRUE " +
        "GROUP BY a.name, a.owner_name ORDER BY total_amount DESC, a.name";

    return read("account summary",
      () -> jdbcTemplate.query(sql, userParams(userId), ACCOUNT_ROW_MAPPER));
  }

  @Override
  public List<MonthlyTrend> getMonthlyTrends(long userId, int months) {
    if (months < 1) {
      throw new FinanceDataAccessException("months must be positive: " + months);
    }
    String sql =
      "SELECT EXTRACT(YEAR FROM e.expense_date) AS yr, EXTRACT(MONTH FROM e.expense_date) AS mon, " +
        "SUM(e.amount) AS total_amount, COUNT(e.id) AS expense_count " +
        "FROM expenses e WHERE e.user_id = :userId AND e.status = TRUE " +
        "GROUP BY EXTRACT(YEAR FROM e.expense_date), EXTRACT(MONTH FROM e.expense_date) " +
        "ORDER BY yr DESC, mon DESC LIMIT :months";

    MapSqlParameterSource params = userParams(userId).addValue("months", months);
    List<MonthlyTrend> latestFirst = read("monthly trends",
      () -> jdbcTemplate.query(sql, params, TREND_ROW_MAPPER));

    List<MonthlyTrend> trends = new ArrayList<>(latestFirst);
    Collections.reverse(trends);
    return trends;
  }

  @Override
  public SavingsSummary getSavingsSummary(long userId) {
    String sql =
      "SELECT sa.id, sa.name, sa.account_type, " +
        "COALESCE(SUM(CASE WHEN st.transaction_type = 'deposit' THEN st.amount END), 0) AS deposits, " +
        "COALESCE(SUM(CASE WHEN st.transaction_type = 'withdrawal' THEN st.amount END), 0) AS withdrawals " +
        "FROM savings_accounts sa LEFT JOIN savings_transactions st ON st.account_id = sa.id " +
        "WHERE sa.user_id = :userId AND sa.is_active = TRUE " +
        "GROUP BY sa.id, sa.name, sa.account_type ORDER BY sa.id";

    String latestValueSql =
      "SELECT amount FROM savings_transactions " +
        "WHERE account_id = :accountId AND transaction_type = 'value_update' " +
        "ORDER BY transaction_date DESC, id DESC LIMIT 1";

    return read("savings summary", () -> {
      List<SavingsAccountSummary> accounts = new ArrayList<>();
      BigDecimal totalDeposits = BigDecimal.ZERO;
      BigDecimal totalWithdrawals = BigDecimal.ZERO;

      List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, userParams(userId));
      for (Map<String, Object> row : rows) {
        BigDecimal deposits = toBigDecimal(row.get("deposits"));
        BigDecimal withdrawals = toBigDecimal(row.get("withdrawals"));
        BigDecimal netDeposits = deposits.subtract(withdrawals);

        List<BigDecimal> latestValue = jdbcTemplate.queryForList(latestValueSql,
          new MapSqlParameterSource("accountId", row.get("id")), BigDecimal.class);
        BigDecimal currentValue = latestValue.isEmpty() ? netDeposits : latestValue.get(0);
        BigDecimal profitLoss = currentValue.subtract(netDeposits);
        BigDecimal percentage = netDeposits.signum() > 0
          ? profitLoss.multiply(BigDecimal.valueOf(100)).divide(netDeposits, 2, RoundingMode.HALF_UP)
          : BigDecimal.ZERO;

        totalDeposits = totalDeposits.add(deposits);
        totalWithdrawals = totalWithdrawals.add(withdrawals);

        accounts.add(new SavingsAccountSummary(
          (String) row.get("name"),
          (String) row.get("account_type"),
          round(deposits),
          round(withdrawals),
          round(netDeposits),
          round(currentValue),
          round(profitLoss),
          round(percentage)));
      }
      return new SavingsSummary(accounts.size(), round(totalDeposits), round(totalWithdrawals),
        accounts);
    });
  }

  @Override
  public CurrentIncomeSources getCurrentIncomeSources(long userId) {
    String sql =
      "SELECT source_name, current_amount FROM income_templates " +
        "WHERE user_id = :userId AND is_active = TRUE ORDER BY id";

    List<IncomeSource> sources = read("current income sources",
      () -> jdbcTemplate.query(sql, userParams(userId), (rs, rowNum) -> new IncomeSource(
        rs.getString("source_name"),
        round(rs.getBigDecimal("current_amount")))));

    BigDecimal total = sources.stream()
      .map(IncomeSource::currentAmount)
      .reduce(BigDecimal.ZERO, BigDecimal::add);
    return new CurrentIncomeSources(round(total), sources, CURRENT_INCOME_NOTE);
  }

  @Override
  public IncomeSummary getIncomeSummary(long userId, YearMonth month) {
    YearMonth effectiveMonth = month != null ? month : YearMonth.now(clock);
    String sql =
      "SELECT source_name, amount, is_one_time FROM monthly_incomes " +
        "WHERE user_id = :userId AND income_month = :month ORDER BY id";

    MapSqlParameterSource params = userParams(userId)
      .addValue("month", effectiveMonth.toString());
    List<Map<String, Object>> rows = read("income summary",
      () -> jdbcTemplate.queryForList(sql, params));

    BigDecimal total = BigDecimal.ZERO;
    BigDecimal recurring = BigDecimal.ZERO;
    BigDecimal oneTime = BigDecimal.ZERO;
    Map<String, BigDecimal> bySource = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      BigDecimal amount = toBigDecimal(row.get("amount"));
      total = total.add(amount);
      if (Boolean.TRUE.equals(row.get("is_one_time"))) {
        oneTime = oneTime.add(amount);
      } else {
        recurring = recurring.add(amount);
      }
      bySource.merge((String) row.get("source_name"), amount, BigDecimal::add);
    }

    List<SourceAmount> sources = bySource.entrySet().stream()
      .map(entry -> new SourceAmount(entry.getKey(), round(entry.getValue())))
      .toList();
    return new IncomeSummary(round(total), round(recurring), round(oneTime), rows.size(), sources,
      effectiveMonth.toString(),
      "This is income for month: " + effectiveMonth
        + ". For CURRENT income sources, use get_current_income_sources()");
  }

  @Override
  public List<ExpenseTemplate> getExpenseTemplates(long userId) {
    String sql =
      "SELECT t.name, t.amount, c.name AS category_name, s.name AS subcategory_name " +
        "FROM expense_templates t " +
        "LEFT JOIN categories c ON t.category_id = c.id " +
        "LEFT JOIN subcategories s ON t.subcategory_id = s.id " +
        "WHERE t.user_id = :userId AND t.is_active = TRUE ORDER BY t.id";

    return read("expense templates",
      () -> jdbcTemplate.query(sql, userParams(userId), TEMPLATE_ROW_MAPPER));
  }

  @Override
  public FinancialHealthMetrics getFinancialHealthMetrics(long userId) {
    LocalDate today = LocalDate.now(clock);
    YearMonth currentMonth = YearMonth.from(today);

    BigDecimal monthIncome = getIncomeSummary(userId, currentMonth).totalIncome();
    BigDecimal monthExpenses = getSpendingSummary(userId, currentMonth.atDay(1), today)
      .activeAmount();
    BigDecimal totalSavingsValue = getSavingsSummary(userId).accounts().stream()
      .map(SavingsAccountSummary::currentValue)
      .reduce(BigDecimal.ZERO, BigDecimal::add);

    BigDecimal monthSavings = monthIncome.subtract(monthExpenses);
    BigDecimal savingsRate = monthIncome.signum() > 0
      ? monthSavings.multiply(BigDecimal.valueOf(100)).divide(monthIncome, 2, RoundingMode.HALF_UP)
      : BigDecimal.ZERO;

    Optional<UserProfile> user = getUserProfile(userId);
    return new FinancialHealthMetrics(
      round(monthIncome),
      round(monthExpenses),
      round(monthSavings),
      round(savingsRate),
      round(totalSavingsValue),
      user.map(u -> u.financialGoals().monthlyIncomeGoal()).orElse(null),
      user.map(u -> u.financialGoals().monthlySavingsGoal()).orElse(null),
      user.map(UserProfile::currency).orElse(agentProperties.getDefaultCurrency()));
  }

  private <T> T read(String what, Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      log.error("Failed to read {}: {}", what, e.getMessage(), e);
      throw new FinanceDataAccessException("Failed to read " + what + ": " + e.getMessage(), e);
    }
  }

  private static MapSqlParameterSource userParams(long userId) {
    return new MapSqlParameterSource("userId", userId);
  }

  private static String dateFilter(MapSqlParameterSource params, LocalDate start, LocalDate end) {
    StringBuilder filter = new StringBuilder();
    if (start != null) {
      filter.append(" AND e.expense_date >= :startDate");
      params.addValue("startDate", Date.valueOf(start));
    }
    if (end != null) {
      filter.append(" AND e.expense_date <= :endDate");
      params.addValue("endDate", Date.valueOf(end));
    }
    return filter.toString();
  }

  private static void checkRange(LocalDate start, LocalDate end) {
    if (start != null && end != null && start.isAfter(end)) {
      throw new FinanceDataAccessException(
        "start_date " + start + " is after end_date " + end);
    }
  }

  private static BigDecimal toBigDecimal(Object value) {
    if (value == null) {
      return BigDecimal.ZERO;
    }
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    return new BigDecimal(value.toString());
  }

  private static BigDecimal round(BigDecimal value) {
    return value == null ? BigDecimal.ZERO.setScale(2)
      : value.setScale(2, RoundingMode.HALF_UP);
  }

  private static DatabaseSchema buildSchema() {
    Map<String, TableInfo> tables = new LinkedHashMap<>();
    tables.put("users", new TableInfo("User profiles with financial goals",
      List.of("id", "email", "full_name", "currency", "timezone", "is_active",
        "household_members", "num_vehicles", "housing_type", "house_size_sqm",
        "monthly_income_goal", "monthly_savings_goal", "created_at", "updated_at"),
      List.of(), List.of()));
    tables.put("expenses", new TableInfo("Daily expense records",
      List.of("id", "user_id", "expense_date", "category_id", "subcategory_id", "amount",
        "status", "account_id"),
      List.of("user", "category", "subcategory", "account"), List.of()));
    tables.put("categories", new TableInfo("Expense/Income categories",
      List.of("id", "user_id", "name", "category_type", "is_active"),
      List.of("subcategories", "expenses"), List.of()));
    tables.put("subcategories", new TableInfo("Subcategories under main categories",
      List.of("id", "category_id", "name", "is_active"), List.of(), List.of()));
    tables.put("accounts", new TableInfo("Payment accounts (bank accounts, credit cards)",
      List.of("id", "user_id", "name", "owner_name"), List.of("expenses"), List.of()));
    tables.put("savings_accounts", new TableInfo("Investment and savings accounts",
      List.of("id", "user_id", "name", "account_type", "description", "is_active",
        "created_at", "updated_at"),
      List.of("transactions"), List.of()));
    tables.put("savings_transactions", new TableInfo("Deposits, withdrawals, and value updates",
      List.of("id", "account_id", "transaction_type", "amount", "transaction_date", "notes",
        "created_at"),
      List.of(), List.of("deposit", "withdrawal", "value_update")));
    tables.put("income_templates", new TableInfo("Recurring income sources",
      List.of("id", "user_id", "source_name", "current_amount", "is_active", "created_at",
        "updated_at"),
      List.of(), List.of()));
    tables.put("monthly_incomes", new TableInfo("Actual monthly income entries",
      List.of("id", "user_id", "income_month", "template_id", "source_name", "amount",
        "is_one_time", "description"),
      List.of(), List.of()));
    tables.put("expense_templates", new TableInfo("Recurring expense templates",
      List.of("id", "user_id", "name", "amount", "category_id", "subcategory_id",
        "account_id", "is_active", "created_at", "updated_at"),
      List.of(), List.of()));
    return new DatabaseSchema(Collections.unmodifiableMap(tables));
  }
}
