package io.portmeta.metadata.api;

/**
 * Exception handling clause. Boundaries are instruction indices, {@code -1} when absent (e.g.
 * the end of the method).
 *
 * @param tryStart first instruction of the protected block
 * @param tryEnd first instruction after the protected block
 * @param filterStart first instruction of the filter block
 * @param handlerStart first instruction of the handler
 * @param handlerEnd first instruction after the handler
 * @param catchType TypeDefOrRef caught by a catch clause, or {@code null}
 * @param handlerType clause kind flags
 */
public record PortableExceptionHandler(
    int tryStart,
    int tryEnd,
    int filterStart,
    int handlerStart,
    int handlerEnd,
    PortableComplexType catchType,
    int handlerType) {}
