package com.healloop.core.scoring;

/**
 * Deterministic score of a patch plan.
 *
 * @param confidence likelihood the patch fixes the failure, in [0, 1]
 * @param riskLevel  blast radius of applying it
 */
public record FixAssessment(double confidence, RiskLevel riskLevel) {}
