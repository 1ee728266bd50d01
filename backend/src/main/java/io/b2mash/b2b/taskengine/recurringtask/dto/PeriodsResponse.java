package io.b2mash.b2b.taskengine.recurringtask.dto;

import java.util.List;

/** Applicable period keys; {@code fiscalYear} is null for the rolling display window. */
public record PeriodsResponse(String recurrencePattern, Integer fiscalYear, List<String> periods) {}
