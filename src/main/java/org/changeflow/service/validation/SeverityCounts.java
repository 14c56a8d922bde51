package org.changeflow.service.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SeverityCounts(int info, int warning, int error, int fatal) {

    public static final SeverityCounts EMPTY = new SeverityCounts(0, 0, 0, 0);

    @JsonProperty("hasBlockingErrors")
    public boolean hasBlockingErrors() {
        return error + fatal > 0;
    }

    @JsonProperty("hasWarnings")
    public boolean hasWarnings() {
        return warning > 0;
    }

    public int total() {
        return info + warning + error + fatal;
    }
}
