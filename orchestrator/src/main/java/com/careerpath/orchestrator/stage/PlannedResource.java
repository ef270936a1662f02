package com.careerpath.orchestrator.stage;

public record PlannedResource(String title, String url, String type) {}
