package com.acme.procmine.api;

import com.acme.procmine.domain.Event;
import com.acme.procmine.domain.EventFilter;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record AnalysisRequest(
    @NotNull List<Event> events,
    List<String> referenceFlow,
    EventFilter filter,
    @Min(1) Integer topN
) {}
