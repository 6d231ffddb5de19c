package com.github.spud.sample.ai.finance.domain.specialist;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.finance.application.config.AgentProperties;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.FinancialGoals;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.HouseholdInfo;
import com.github.spud.sample.ai.finance.domain.data.FinanceDataAccess.UserProfile;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UserContextPromptTest {

  private final UserContextPrompt prompt = new UserContextPrompt(
    Clock.fixed(Instant.parse("2024-03-15T23:30:00Z"), ZoneOffset.UTC), new AgentProperties());

  private static UserProfile anna(String timezone) {
    return new UserProfile(1L, "anna@example.com", "Anna Svensson", "SEK", timezone,
      new HouseholdInfo(4, 1, "Villa", new BigDecimal("140")),
      new FinancialGoals(new BigDecimal("60000.00"), null),
      "2023-01-01", null);
  }

  @Test
  @DisplayName("User context lists name, currency, household and goals")
  void shouldRenderUserContext() {
    String context = prompt.userContext(Optional.of(anna("Europe/Stockholm")));

    assertThat(context)
      .contains("User's Name: Anna Svensson")
      .contains("Currency: SEK")
      .contains("Household Members: 4")
      .contains("Housing Type: Villa")
      .contains("Monthly Income Goal: 60000.00")
      .contains("Monthly Savings Goal: Not set");
  }

  @Test
  @DisplayName("Without a profile the defaults are used")
  void shouldUseDefaultsWithoutProfile() {
    String context = prompt.userContext(Optional.empty());

    assertThat(context)
      .contains("User's Name: User")
      .contains("Currency: SEK")
      .contains("Vehicles: Not specified");
  }

  @Test
  @DisplayName("Date and time are rendered in the user's timezone")
  void shouldUseUserTimezone() {
    String context = prompt.orchestratorContext(Optional.of(anna("Europe/Stockholm")));

    assertThat(context)
      .contains("Today's Date: 2024-03-16")
      .contains("Current Time: 00:30")
      .contains("Current Month: March 2024 (2024-03)")
      .contains("Day of Week: Saturday")
      .contains("Timezone: Europe/Stockholm");
  }

  @Test
  @DisplayName("An unknown timezone falls back to UTC")
  void shouldFallBackToUtc() {
    String context = prompt.orchestratorContext(Optional.of(anna("Mars/Olympus")));

    assertThat(context)
      .contains("Today's Date: 2024-03-15")
      .contains("Day of Week: Friday")
      .contains("Timezone: UTC");
  }
}
