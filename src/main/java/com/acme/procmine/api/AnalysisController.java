package com.acme.procmine.api;

import com.acme.procmine.app.AnalysisReport;
import com.acme.procmine.app.AnalysisService;
import com.acme.procmine.demo.SampleLogGenerator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/analysis")
public class AnalysisController {
  private final AnalysisService service;
  private final SampleLogGenerator samples;

  public AnalysisController(AnalysisService service, SampleLogGenerator samples) {
    this.service = service; this.samples = samples;
  }

  @PostMapping
  public ResponseEntity<AnalysisReport> analyze(@Valid @RequestBody AnalysisRequest req) {
    return ResponseEntity.ok(service.analyze(req.events(), req.referenceFlow(), req.filter(), req.topN()));
  }

  @GetMapping("/sample")
  public ResponseEntity<AnalysisReport> sample(@RequestParam(defaultValue = "50") @Min(0) @Max(10_000) int cases,
                                               @RequestParam(defaultValue = "42") long seed) {
    var events = samples.generate(service.defaultReferenceFlow(), cases, seed);
    return ResponseEntity.ok(service.analyze(events));
  }
}
