package io.b2mash.b2b.taskengine.recurringtask.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record BulkCompletionRequest(@NotEmpty List<@Valid SetCompletionRequest> entries) {}
