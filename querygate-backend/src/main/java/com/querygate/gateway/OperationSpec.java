package com.querygate.gateway;

import com.querygate.api.OperationRequest;
import com.querygate.model.QueryRequest;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OperationSpec {
    String name;
    String operationKind;
    String description;
    OperationTarget target;
    boolean cacheable;
    RequestShaper shaper;

    /**
     * Builds the gateway request for one call of an operation.
     */
    @FunctionalInterface
    public interface RequestShaper {

        /**
         * @throws com.querygate.error.ValidationFailedException when a required parameter is missing
         */
        QueryRequest shape(OperationRequest params);
    }

    public QueryRequest shape(OperationRequest params) {
        return shaper.shape(params != null ? params : new OperationRequest());
    }
}
