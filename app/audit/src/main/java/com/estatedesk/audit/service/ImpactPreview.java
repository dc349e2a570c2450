package com.estatedesk.audit.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImpactPreview(String primaryEntity, int relatedCount, RiskLevel riskLevel, String summary) {}
