package io.b2mash.b2b.taskengine.completion;

public enum CompletionStatus {
  COMPLETED,
  INCOMPLETE,
  NOT_YET_DUE
}
