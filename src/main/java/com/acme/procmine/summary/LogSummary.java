package com.acme.procmine.summary;

import java.util.List;

public record LogSummary(int caseCount, int eventCount, int resourceCount,
                         List<ActivityCount> topActivities, List<DailyCaseCount> casesPerDay) {}
