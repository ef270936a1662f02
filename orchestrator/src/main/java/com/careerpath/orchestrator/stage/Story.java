package com.careerpath.orchestrator.stage;

/**
 * One first-hand account of a career transition.
 * url and date may be null; source and content never are.
 */
public record Story(String source, String content, String url, String date) {}
