package io.b2mash.b2b.taskengine.completion;

/** One cell write of a bulk completion update. */
public record CompletionEntry(
    String clientId, String periodKey, boolean completed, ArnDetails arn) {}
