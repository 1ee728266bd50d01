package io.b2mash.b2b.taskengine.completion;

import io.b2mash.b2b.taskengine.exception.ResourceConflictException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

@Repository
public class JpaCompletionStore implements CompletionStore {

  private final CompletionRecordRepository repository;

  public JpaCompletionStore(CompletionRecordRepository repository) {
    this.repository = repository;
  }

  @Override
  public Optional<CompletionRecord> get(UUID taskId, String clientId, String periodKey) {
    return repository.findByRecurringTaskIdAndClientIdAndPeriodKey(taskId, clientId, periodKey);
  }

  @Override
  public CompletionRecord put(CompletionRecord record) {
    try {
      return repository.saveAndFlush(record);
    } catch (DataIntegrityViolationException ex) {
      // Two first-time writes for the same cell raced; the caller may retry as an update
      throw new ResourceConflictException(
          "Concurrent completion update",
          "Completion for client "
              + record.getClientId()
              + " and period "
              + record.getPeriodKey()
              + " was created concurrently. Please retry.");
    }
  }

  @Override
  public List<CompletionRecord> query(UUID taskId) {
    return repository.findByRecurringTaskIdOrderByPeriodKeyAscClientIdAsc(taskId);
  }

  @Override
  public boolean exists(UUID taskId) {
    return repository.existsByRecurringTaskId(taskId);
  }
}
