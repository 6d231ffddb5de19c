package com.github.spud.sample.ai.finance.domain.tools;

import com.github.spud.sample.ai.finance.util.JsonUtils;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.util.json.schema.JsonSchemaGenerator;
import org.springframework.boot.json.JsonParseException;
import org.springframework.util.StringUtils;

/**
 * A typed capability: arguments are parsed into the record {@code I}, validated with Bean
 * Validation and passed to the handler. The handler result is serialised as the tool payload.
 *
 * @param <I> argument record type, also the source of the JSON input schema
 */
public class CapabilityToolCallback<I> implements ToolCallback {

  private final ToolDefinition definition;

  private final Class<I> argumentType;

  private final Function<I, Object> handler;

  private final Validator validator;

  private CapabilityToolCallback(String name, String description, Class<I> argumentType,
    Function<I, Object> handler, Validator validator) {
    this.definition = DefaultToolDefinition.builder()
      .name(name)
      .description(description)
      .inputSchema(JsonSchemaGenerator.generateForType(argumentType))
      .build();
    this.argumentType = argumentType;
    this.handler = handler;
    this.validator = validator;
  }

  public static <I> CapabilityToolCallback<I> of(String name, String description,
    Class<I> argumentType, Validator validator, Function<I, Object> handler) {
    return new CapabilityToolCallback<>(name, description, argumentType, handler, validator);
  }

  @Override
  public ToolDefinition getToolDefinition() {
    return definition;
  }

  @Override
  public String call(String toolInput) {
    I arguments = parseArguments(toolInput);
    validate(arguments);
    Object result = handler.apply(arguments);
    return JsonUtils.toJson(result);
  }

  private I parseArguments(String toolInput) {
    String json = StringUtils.hasText(toolInput) ? toolInput : "{}";
    try {
      return JsonUtils.fromJson(json, argumentType);
    } catch (JsonParseException e) {
      throw new CapabilityException(
        "Invalid arguments for " + definition.name() + ": " + e.getMessage(), e);
    }
  }

  private void validate(I arguments) {
    Set<ConstraintViolation<I>> violations = validator.validate(arguments);
    if (violations.isEmpty()) {
      return;
    }
    String message = violations.stream()
      .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
      .map(v -> v.getPropertyPath() + " " + v.getMessage())
      .collect(Collectors.joining("; "));
    throw new CapabilityException("Invalid arguments for " + definition.name() + ": " + message);
  }
}
