package com.acme.procmine.rootcause;

/** @param errorRate errors per 100 performed events, 0 when the resource did nothing */
public record ResourceProfile(String resource, int workload, int errors, double errorRate, Severity severity) {}
