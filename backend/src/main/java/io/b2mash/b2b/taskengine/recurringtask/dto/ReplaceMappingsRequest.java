package io.b2mash.b2b.taskengine.recurringtask.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ReplaceMappingsRequest(@NotNull List<@Valid MappingRequest> mappings) {}
