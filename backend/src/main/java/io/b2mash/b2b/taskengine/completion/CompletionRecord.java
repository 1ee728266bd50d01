package io.b2mash.b2b.taskengine.completion;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(
    name = "completion_records",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_completion_task_client_period",
            columnNames = {"recurring_task_id", "client_id", "period_key"}))
public class CompletionRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "recurring_task_id", nullable = false)
  private UUID recurringTaskId;

  @Column(name = "client_id", nullable = false, length = 100)
  private String clientId;

  // Format: YYYY-MM
  @Column(name = "period_key", nullable = false, length = 7)
  private String periodKey;

  @Column(name = "is_completed", nullable = false)
  private boolean completed;

  @Column(name = "completed_by", length = 100)
  private String completedBy;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "arn_number", length = 15)
  private String arnNumber;

  @Column(name = "arn_name", length = 200)
  private String arnName;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CompletionRecord() {}

  public CompletionRecord(UUID recurringTaskId, String clientId, String periodKey, Instant now) {
    this.recurringTaskId = recurringTaskId;
    this.clientId = clientId;
    this.periodKey = periodKey;
    this.completed = false;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /**
   * Marks the cell complete. Re-marking by the same actor with the same ARN keeps the original
   * timestamp.
   *
   * @return false if nothing changed
   */
  public boolean markCompleted(String actorId, Instant at, ArnDetails arn) {
    String newArnNumber = arn != null ? arn.arnNumber() : null;
    String newArnName = arn != null ? arn.arnName() : null;
    if (completed
        && Objects.equals(completedBy, actorId)
        && Objects.equals(arnNumber, newArnNumber)
        && Objects.equals(arnName, newArnName)) {
      return false;
    }
    this.completed = true;
    this.completedBy = actorId;
    this.completedAt = at;
    this.arnNumber = newArnNumber;
    this.arnName = newArnName;
    this.updatedAt = at;
    return true;
  }

  /**
   * Clears the completion but keeps the row, so an unmarked cell stays distinguishable from one
   * that was never touched.
   *
   * @return false if the cell was already incomplete
   */
  public boolean markIncomplete(Instant at) {
    if (!completed) {
      return false;
    }
    this.completed = false;
    this.completedBy = null;
    this.completedAt = null;
    this.arnNumber = null;
    this.arnName = null;
    this.updatedAt = at;
    return true;
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecurringTaskId() {
    return recurringTaskId;
  }

  public String getClientId() {
    return clientId;
  }

  public String getPeriodKey() {
    return periodKey;
  }

  public boolean isCompleted() {
    return completed;
  }

  public String getCompletedBy() {
    return completedBy;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public String getArnNumber() {
    return arnNumber;
  }

  public String getArnName() {
    return arnName;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
