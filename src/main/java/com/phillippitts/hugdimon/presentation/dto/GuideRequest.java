package com.phillippitts.hugdimon.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /guide}.
 */
public record GuideRequest(@JsonProperty("query") String query) {}
