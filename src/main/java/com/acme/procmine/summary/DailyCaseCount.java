package com.acme.procmine.summary;

import java.time.LocalDate;

/** Distinct cases with at least one event on {@code date}. */
public record DailyCaseCount(LocalDate date, int cases) {}
