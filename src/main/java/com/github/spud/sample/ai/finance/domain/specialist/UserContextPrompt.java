package com.github.spud.sample.ai.finance.domain.specialist;

import com.github.spud.sample.ai.finance.application.config.AgentProperties;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.FinancialGoals;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.HouseholdInfo;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.UserProfile;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders the user context block that prefixes every agent's instructions
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserContextPrompt {

  private static final String NOT_SPECIFIED = "Not specified";

  private static final String NOT_SET = "Not set";

  private static final DateTimeFormatter MONTH_NAME =
    DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

  private static final DateTimeFormatter DAY_NAME =
    DateTimeFormatter.ofPattern("EEEE", Locale.ENGLISH);

  private static final ZoneId UTC = ZoneId.of("UTC");

  private final Clock clock;

  private final AgentProperties agentProperties;

  public String fullName(Optional<UserProfile> profile) {
    return profile.map(UserProfile::fullName).filter(name -> !name.isBlank()).orElse("User");
  }

  public String currency(Optional<UserProfile> profile) {
    return profile.map(UserProfile::currency).orElse(agentProperties.getDefaultCurrency());
  }

  /**
   * User context shared by the specialists: name, currency, household and goals
   */
  public String userContext(Optional<UserProfile> profile) {
    HouseholdInfo household = profile.map(UserProfile::householdInfo).orElse(null);
    FinancialGoals goals = profile.map(UserProfile::financialGoals).orElse(null);
    String currency = currency(profile);

    return """
      USER CONTEXT (use this for every answer):
      - User's Name: %s
      - Currency: %s (all amounts are already in this currency, never convert)
      - Household Members: %s
      - Vehicles: %s
      - Housing Type: %s
      - House Size: %s sqm
      - Monthly Income Goal: %s
      - Monthly Savings Goal: %s
      """.formatted(
      fullName(profile),
      currency,
      orNotSpecified(household != null ? household.householdMembers() : null),
      orNotSpecified(household != null ? household.numVehicles() : null),
      orNotSpecified(household != null ? household.housingType() : null),
      orNotSpecified(household != null ? household.houseSizeSqm() : null),
      orNotSet(goals != null ? goals.monthlyIncomeGoal() : null),
      orNotSet(goals != null ? goals.monthlySavingsGoal() : null));
  }

  /**
   * Current date and time in the user's timezone, followed by the user context. An unknown
   * timezone falls back to UTC.
   */
  public String orchestratorContext(Optional<UserProfile> profile) {
    ZoneId zone = resolveZone(profile.map(UserProfile::timezone).orElse(null));
    ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));

    return """
      CURRENT DATE & TIME:
      - Today's Date: %s
      - Current Time: %s
      - Current Month: %s (%s)
      - Day of Week: %s
      - Timezone: %s

      %s
      All date references are in the user's timezone (%s).
      """.formatted(
      now.toLocalDate(),
      now.toLocalTime().withNano(0),
      now.format(MONTH_NAME), YearMonth.from(now),
      now.format(DAY_NAME),
      zone.getId(),
      userContext(profile),
      zone.getId());
  }

  ZoneId resolveZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return UTC;
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException e) {
      log.warn("Invalid timezone '{}', falling back to UTC", timezone);
      return UTC;
    }
  }

  private static String orNotSpecified(Object value) {
    return value != null ? value.toString() : NOT_SPECIFIED;
  }

  private static String orNotSet(Object value) {
    return value != null ? value.toString() : NOT_SET;
  }
}
