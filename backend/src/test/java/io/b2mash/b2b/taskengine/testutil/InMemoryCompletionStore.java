package io.b2mash.b2b.taskengine.testutil;

import io.b2mash.b2b.taskengine.completion.CompletionRecord;
import io.b2mash.b2b.taskengine.completion.CompletionStore;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryCompletionStore implements CompletionStore {

  private final Map<String, CompletionRecord> records = new LinkedHashMap<>();
  private int putCount;

  @Override
  public Optional<CompletionRecord> get(UUID taskId, String clientId, String periodKey) {
    return Optional.ofNullable(records.get(key(taskId, clientId, periodKey)));
  }

  @Override
  public CompletionRecord put(CompletionRecord record) {
    if (record.getId() == null) {
      TestEntities.setId(record, UUID.randomUUID());
    }
    var cellKey = key(record.getRecurringTaskId(), record.getClientId(), record.getPeriodKey());
    records.put(cellKey, record);
    putCount++;
    return record;
  }

  @Override
  public List<CompletionRecord> query(UUID taskId) {
    return records.values().stream()
        .filter(r -> r.getRecurringTaskId().equals(taskId))
        .sorted(
            Comparator.comparing(CompletionRecord::getPeriodKey)
                .thenComparing(CompletionRecord::getClientId))
        .toList();
  }

  @Override
  public boolean exists(UUID taskId) {
    return records.values().stream().anyMatch(r -> r.getRecurringTaskId().equals(taskId));
  }

  public int size() {
    return records.size();
  }

  public int putCount() {
    return putCount;
  }

  private static String key(UUID taskId, String clientId, String periodKey) {
    return taskId + "|" + clientId + "|" + periodKey;
  }
}
