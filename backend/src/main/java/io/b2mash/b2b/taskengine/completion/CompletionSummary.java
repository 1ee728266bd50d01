package io.b2mash.b2b.taskengine.completion;

/** Completed cells over expected cells of a completion matrix, with a rounded percentage. */
public record CompletionSummary(long completedCount, long totalExpected, int percentage) {

  public static CompletionSummary of(long completedCount, long totalExpected) {
    int percentage =
        totalExpected == 0 ? 0 : (int) Math.round(100.0 * completedCount / totalExpected);
    return new CompletionSummary(completedCount, totalExpected, percentage);
  }
}
