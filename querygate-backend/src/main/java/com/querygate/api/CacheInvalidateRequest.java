package com.querygate.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import lombok.Data;

@Data
public class CacheInvalidateRequest {
    private String key;
    private String prefix;

    @JsonIgnore
    @AssertTrue(message = "Exactly one of key or prefix is required")
    public boolean isSingleTarget() {
        boolean hasKey = key != null && !key.isBlank();
        boolean hasPrefix = prefix != null && !prefix.isBlank();
        return hasKey ^ hasPrefix;
    }
}
