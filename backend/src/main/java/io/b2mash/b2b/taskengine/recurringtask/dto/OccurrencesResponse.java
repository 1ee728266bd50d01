package io.b2mash.b2b.taskengine.recurringtask.dto;

import java.time.LocalDate;
import java.util.List;

public record OccurrencesResponse(LocalDate from, LocalDate to, List<LocalDate> occurrences) {}
