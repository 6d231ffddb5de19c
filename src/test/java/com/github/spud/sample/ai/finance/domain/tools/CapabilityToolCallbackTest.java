package com.github.spud.sample.ai.finance.domain.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.finance.util.JsonUtils;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.annotation.ToolParam;

class CapabilityToolCallbackTest {

  private static final Validator VALIDATOR =
    Validation.buildDefaultValidatorFactory().getValidator();

  record RangeArguments(
    @JsonProperty("start_date")
    @ToolParam(description = "Start date", required = false)
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "must be in YYYY-MM-DD format")
    String startDate,

    @JsonProperty("months")
    @ToolParam(description = "Months", required = false)
    @Min(1) @Max(24)
    Integer months) {

  }

  record Total(String category, BigDecimal totalAmount) {

  }

  private final AtomicReference<RangeArguments> received = new AtomicReference<>();

  private final CapabilityToolCallback<RangeArguments> callback = CapabilityToolCallback.of(
    "get_total", "Total for a range", RangeArguments.class, VALIDATOR,
    args -> {
      received.set(args);
      return new Total("Groceries", new BigDecimal("950.75"));
    });

  @Test
  @DisplayName("Definition carries the name, description and a schema generated from the argument record")
  void shouldDescribeCapability() {
    assertThat(callback.getToolDefinition().name()).isEqualTo("get_total");
    assertThat(callback.getToolDefinition().description()).isEqualTo("Total for a range");

    JsonNode schema = JsonUtils.readTree(callback.getToolDefinition().inputSchema());
    assertThat(schema.path("type").asText()).isEqualTo("object");
    assertThat(schema.path("properties").has("start_date")).isTrue();
    assertThat(schema.path("properties").has("months")).isTrue();
  }

  @Test
  @DisplayName("Arguments are parsed into the record and the result serialised with snake_case names")
  void shouldParseAndSerialise() {
    String payload = callback.call("{\"start_date\":\"2024-02-01\",\"months\":3}");

    assertThat(received.get()).isEqualTo(new RangeArguments("2024-02-01", 3));
    assertThat(payload).isEqualTo("{\"category\":\"Groceries\",\"total_amount\":950.75}");
  }

  @Test
  @DisplayName("Missing or empty arguments mean all optional arguments are absent")
  void shouldAcceptEmptyArguments() {
    callback.call("");
    assertThat(received.get()).isEqualTo(new RangeArguments(null, null));

    callback.call("{}");
    assertThat(received.get()).isEqualTo(new RangeArguments(null, null));
  }

  @Test
  @DisplayName("Malformed JSON is rejected before the handler runs")
  void shouldRejectMalformedJson() {
    assertThatThrownBy(() -> callback.call("{not json"))
      .isInstanceOf(CapabilityException.class)
      .hasMessageContaining("Invalid arguments for get_total");
    assertThat(received.get()).isNull();
  }

  @Test
  @DisplayName("Constraint violations are rejected with the offending property named")
  void shouldRejectInvalidArguments() {
    assertThatThrownBy(() -> callback.call("{\"start_date\":\"01/02/2024\"}"))
      .isInstanceOf(CapabilityException.class)
      .hasMessageContaining("startDate must be in YYYY-MM-DD format");

    assertThatThrownBy(() -> callback.call("{\"months\":0}"))
      .isInstanceOf(CapabilityException.class)
      .hasMessageContaining("months");
    assertThat(received.get()).isNull();
  }
}
