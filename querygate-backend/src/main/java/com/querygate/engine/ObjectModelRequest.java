package com.querygate.engine;

import lombok.NonNull;
import lombok.Value;

/**
 * One collection read on the object-model interface, optionally narrowed to a single table.
 */
@Value
public class ObjectModelRequest {
    @NonNull
    ModelCollection collection;
    String tableFilter;

    public static ObjectModelRequest of(ModelCollection collection) {
        return new ObjectModelRequest(collection, null);
    }
}
