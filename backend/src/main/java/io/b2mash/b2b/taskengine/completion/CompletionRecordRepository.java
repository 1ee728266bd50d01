package io.b2mash.b2b.taskengine.completion;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CompletionRecordRepository extends JpaRepository<CompletionRecord, UUID> {

  Optional<CompletionRecord> findByRecurringTaskIdAndClientIdAndPeriodKey(
      UUID recurringTaskId, String clientId, String periodKey);

  List<CompletionRecord> findByRecurringTaskIdOrderByPeriodKeyAscClientIdAsc(
      UUID recurringTaskId);

  boolean existsByRecurringTaskId(UUID recurringTaskId);
}
