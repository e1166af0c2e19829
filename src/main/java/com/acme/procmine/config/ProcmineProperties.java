package com.acme.procmine.config;

import com.acme.procmine.rootcause.IssueRule;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "procmine")
public record ProcmineProperties(
    @NotEmpty List<String> referenceFlow,
    @Valid @DefaultValue Conformance conformance,
    @Valid @DefaultValue Bottleneck bottleneck,
    @Valid @DefaultValue Summary summary,
    @Valid @DefaultValue Anomaly anomaly,
    List<IssueRule> issues
) {
  public ProcmineProperties {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public record Conformance(
      @DefaultValue("2") @Min(0) int extraTolerance,
      @DefaultValue("1") @Min(0) int missingTolerance,
      @DefaultValue("0.1") @DecimalMin("0") @DecimalMax("1") double orderPenalty,
      @DefaultValue("0.8") @DecimalMin("0") @DecimalMax("1") double conformingThreshold,
      @DefaultValue("0.5") @DecimalMin("0") @DecimalMax("1") double partialThreshold) {}

  public record Bottleneck(@DefaultValue("8") @Min(1) int topN) {}

  public record Summary(@DefaultValue("10") @Min(1) int topActivities, @DefaultValue("UTC") String zone) {}

  public record Anomaly(@DefaultValue("none") String mode,
                        @DefaultValue("0.1") @DecimalMin("0") @DecimalMax("1") double rate,
                        Long seed) {}
}
