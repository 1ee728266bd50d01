package io.b2mash.b2b.taskengine.completion;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Persistence seam for the (task, client, period) completion matrix. */
public interface CompletionStore {

  Optional<CompletionRecord> get(UUID taskId, String clientId, String periodKey);

  /** Inserts or updates the record for its (task, client, period) key. */
  CompletionRecord put(CompletionRecord record);

  /** All records of a task, ordered by period key then client id. */
  List<CompletionRecord> query(UUID taskId);

  boolean exists(UUID taskId);
}
