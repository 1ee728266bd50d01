package io.b2mash.b2b.taskengine.completion;

import java.util.List;
import java.util.Map;

/**
 * Client x period view of a task for one fiscal year. Rows cover the viewer's visible clients;
 * columns are the applicable periods of the year.
 */
public record CompletionGrid(
    int fiscalYear, List<String> periods, List<ClientRow> rows, CompletionSummary summary) {

  /**
   * @param statuses status per period key, in column order
   * @param summary completed over elapsed periods for this client
   */
  public record ClientRow(
      String clientId, Map<String, CompletionStatus> statuses, CompletionSummary summary) {}
}
