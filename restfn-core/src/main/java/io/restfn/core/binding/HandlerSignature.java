package io.restfn.core.binding;

import java.lang.reflect.Type;
import java.util.List;

/**
 * The analysed shape of a handler: one slot per declared parameter and the return shape.
 */
public record HandlerSignature(List<ParameterSlot> parameters, ReturnShape returnShape, Type returnType) {
    public HandlerSignature {
        parameters = List.copyOf(parameters);
    }

    public long pathParameterCount() {
        return parameters.stream().filter(p -> p instanceof ParameterSlot.PathParameter).count();
    }

    public boolean hasBody() {
        return parameters.stream().anyMatch(p -> p instanceof ParameterSlot.Body);
    }
}
