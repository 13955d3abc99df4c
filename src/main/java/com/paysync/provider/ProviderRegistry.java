package com.paysync.provider;

import com.paysync.model.ProviderType;
import com.paysync.sync.ProviderCollector;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

@Component
public class ProviderRegistry {
  private final Map<ProviderType, ProviderCollector> collectors = new EnumMap<>(ProviderType.class);

  public ProviderRegistry(List<ProviderCollector> collectors) {
    for (ProviderCollector collector : collectors) {
      this.collectors.put(collector.getProviderType(), collector);
    }
  }

  public ProviderCollector require(ProviderType providerType) {
    ProviderCollector collector = providerType == null ? null : collectors.get(providerType);
    if (collector == null) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown provider: " + providerType);
    }
    return collector;
  }
}
