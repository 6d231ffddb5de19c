package com.github.spud.sample.ai.finance.domain.tools;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Capability table of one agent. Fixed at construction, looked up by name on every tool call.
 */
@Slf4j
public class ToolRegistry {

  /**
   * tool name -> ToolCallback, in registration order
   */
  private final Map<String, ToolCallback> callbackMap = new LinkedHashMap<>();

  public static ToolRegistry of(Collection<? extends ToolCallback> callbacks) {
    ToolRegistry registry = new ToolRegistry();
    callbacks.forEach(registry::register);
    return registry;
  }

  public void register(ToolCallback callback) {
    ToolDefinition def = callback.getToolDefinition();
    if (def == null) {
      throw new IllegalArgumentException("Cannot register tool without definition: " + callback);
    }
    if (callbackMap.containsKey(def.name())) {
      throw new IllegalArgumentException("Duplicate tool name: " + def.name());
    }
    log.debug("Registering tool: {}", def.name());
    callbackMap.put(def.name(), callback);
  }

  public Optional<ToolCallback> getCallback(String toolName) {
    if (toolName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(callbackMap.get(toolName));
  }

  /**
   * Callbacks offered to the completion service as capability descriptors
   */
  public List<ToolCallback> getAllCallbacks() {
    return new ArrayList<>(callbackMap.values());
  }

  public List<String> getToolNames() {
    return new ArrayList<>(callbackMap.keySet());
  }

  public boolean hasToolByName(String toolName) {
    return callbackMap.containsKey(toolName);
  }
}
