package com.partselect.assistant.dto;

import com.partselect.assistant.model.CatalogEntry;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Raw catalog search result for debugging")
public record LookupResponse(String q, List<CatalogEntry> hits, int count) {
}
