package com.acme.procmine.rootcause;

public record IssueCategory(String category, int count, Severity severity) {}
