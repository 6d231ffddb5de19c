package com.github.spud.sample.ai.finance.domain.orchestrator;

import com.github.spud.sample.ai.finance.domain.agent.ToolCallAgent;
import com.github.spud.sample.ai.finance.domain.tools.CapabilityException;
import com.github.spud.sample.ai.finance.util.JsonUtils;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.util.json.schema.JsonSchemaGenerator;
import org.springframework.boot.json.JsonParseException;
import org.springframework.util.StringUtils;

/**
 * Orchestrator capability that hands a question to one specialist and returns its answer as
 * {@code {"agent": ..., "response": ...}}
 */
@Slf4j
public class DelegationToolCallback implements ToolCallback {

  private static final String PREFIX = "consult_";

  private final ToolDefinition definition;

  private final ToolCallAgent specialist;

  public DelegationToolCallback(ToolCallAgent specialist, String description) {
    this.specialist = specialist;
    this.definition = DefaultToolDefinition.builder()
      .name(toolName(specialist.getName()))
      .description(description)
      .inputSchema(JsonSchemaGenerator.generateForType(DelegationArguments.class))
      .build();
  }

  /**
   * {@code "Analytics Agent"} becomes {@code consult_analytics_agent}
   */
  public static String toolName(String agentName) {
    String slug = agentName.toLowerCase(Locale.ROOT)
      .replaceAll("[^a-z0-9]+", "_")
      .replaceAll("^_+|_+$", "");
    return PREFIX + slug;
  }

  public String getAgentName() {
    return specialist.getName();
  }

  @Override
  public ToolDefinition getToolDefinition() {
    return definition;
  }

  @Override
  public String call(String toolInput) {
    String query = parseQuery(toolInput);
    log.info("Delegating to {}: {}", getAgentName(), StringUtils.truncate(query, 100));

    String response = specialist.chat(query);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("agent", getAgentName());
    payload.put("response", response);
    return JsonUtils.toJson(payload);
  }

  private String parseQuery(String toolInput) {
    if (!StringUtils.hasText(toolInput)) {
      return "";
    }
    try {
      DelegationArguments arguments = JsonUtils.fromJson(toolInput, DelegationArguments.class);
      return arguments.query() != null ? arguments.query() : "";
    } catch (JsonParseException e) {
      throw new CapabilityException("Invalid arguments for " + definition.name(), e);
    }
  }

  public record DelegationArguments(
    @ToolParam(description = "The specific question to ask the agent")
    String query) {

  }
}
