package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk layout of a benchmark file: {@code {"entries": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoldStandardFile {

    private List<GoldStandardEntry> entries = new ArrayList<>();

    public List<GoldStandardEntry> getEntries() {
        return entries;
    }

    public void setEntries(List<GoldStandardEntry> entries) {
        this.entries = entries != null ? entries : new ArrayList<>();
    }
}
