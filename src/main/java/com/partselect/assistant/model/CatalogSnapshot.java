package com.partselect.assistant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the persisted catalog: {@code {"meta": {...}, "items": [...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogSnapshot {
    private Map<String, Object> meta;
    private List<CatalogEntry> items = new ArrayList<>();
}
