package com.acme.procmine.summary;

public record ActivityCount(String activity, int count) {}
