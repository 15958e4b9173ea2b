package com.marketcore.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Thrown when two consolidators are wired together but the first one's output type
 * is not the second one's input type. Raised at wiring time, never mid-stream.
 */
@Getter
public class TypeMismatchException extends BaseException {

    private final Class<?> firstOutputType;
    private final Class<?> secondInputType;

    public TypeMismatchException(Class<?> firstOutputType, Class<?> secondInputType) {
        super(
                ErrorCode.TYPE_MISMATCH,
                String.format(
                        "first.outputType must equal second.inputType (first produces %s, second consumes %s)",
                        firstOutputType.getSimpleName(), secondInputType.getSimpleName()),
                Map.of("firstOutputType", firstOutputType.getName(), "secondInputType", secondInputType.getName()));
        this.firstOutputType = firstOutputType;
        this.secondInputType = secondInputType;
    }
}
