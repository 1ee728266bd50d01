package io.b2mash.b2b.taskengine.recurringtask.dto;

import io.b2mash.b2b.taskengine.completion.ArnDetails;
import io.b2mash.b2b.taskengine.completion.CompletionEntry;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SetCompletionRequest(
    @NotBlank String clientId,
    @NotBlank String periodKey,
    @NotNull Boolean completed,
    String arnNumber,
    String arnName) {

  public ArnDetails arn() {
    return arnNumber == null && arnName == null ? null : new ArnDetails(arnNumber, arnName);
  }

  public CompletionEntry toEntry() {
    return new CompletionEntry(clientId, periodKey, completed, arn());
  }
}
