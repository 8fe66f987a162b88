package com.scholary.tracklist.provider;

import com.scholary.tracklist.config.ConfigurationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Looks up provider clients by name and resolves a priority order to concrete clients. */
public class ProviderRegistry {

  private final Map<String, ProviderClient> clients = new LinkedHashMap<>();

  public ProviderRegistry(List<ProviderClient> clients) {
    for (ProviderClient client : clients) {
      ProviderClient previous = this.clients.put(client.name(), client);
      if (previous != null) {
        throw new ConfigurationException("Duplicate provider name: " + client.name());
      }
    }
  }

  /**
   * Resolve a priority order.
   *
   * @param priorityOrder provider names, highest priority first
   * @return the clients in the same order
   * @throws ConfigurationException if the order is empty, repeats a name, or names an unknown
   *     or disabled provider
   */
  public List<ProviderClient> resolve(List<String> priorityOrder) {
    if (priorityOrder == null || priorityOrder.isEmpty()) {
      throw new ConfigurationException("providerPriorityOrder must not be empty");
    }
    List<String> violations = new ArrayList<>();
    List<ProviderClient> resolved = new ArrayList<>();
    for (String name : priorityOrder) {
      ProviderClient client = clients.get(name);
      if (client == null) {
        violations.add(
            "Unknown or disabled provider '" + name + "', available: " + clients.keySet());
      } else if (resolved.contains(client)) {
        violations.add("Provider '" + name + "' listed more than once");
      } else {
        resolved.add(client);
      }
    }
    if (!violations.isEmpty()) {
      throw new ConfigurationException(violations);
    }
    return List.copyOf(resolved);
  }

  public Set<String> names() {
    return Set.copyOf(clients.keySet());
  }
}
