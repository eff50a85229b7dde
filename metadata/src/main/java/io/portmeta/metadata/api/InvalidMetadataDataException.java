package io.portmeta.metadata.api;

/**
 * Exception thrown when serialized metadata (compact complex-type text, JSON, signatures)
 * is malformed or structurally inconsistent.
 */
public class InvalidMetadataDataException extends PortableMetadataException {

    /**
     * Constructs a new InvalidMetadataDataException with the specified message.
     *
     * @param message the detail message
     */
    public InvalidMetadataDataException(String message) {
        super(message, null, "INVALID_DATA");
    }

    /**
     * Constructs a new InvalidMetadataDataException with the specified message and context.
     *
     * @param message the detail message
     * @param context the offending input or a description of where it was found
     */
    public InvalidMetadataDataException(String message, String context) {
        super(message, context, "INVALID_DATA");
    }

    /**
     * Constructs a new InvalidMetadataDataException with the specified message, cause, and context.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param context the offending input or a description of where it was found
     */
    public InvalidMetadataDataException(String message, Throwable cause, String context) {
        super(message, cause, context, "INVALID_DATA");
    }

    /**
     * Creates an exception for a compact complex-type string that could not be parsed.
     *
     * @param input the full input being parsed
     * @param position the cursor position the error was detected at
     * @param detail what was expected
     * @return a new InvalidMetadataDataException instance
     */
    public static InvalidMetadataDataException syntaxError(
            String input, int position, String detail) {
        return new InvalidMetadataDataException(
            String.format("Invalid complex type at position %d: %s", position, detail),
            input
        );
    }

    /**
     * Creates an exception for a type code with no known element type or calling convention.
     *
     * @param kind the kind of code ("element type", "calling convention")
     * @param code the unknown code
     * @return a new InvalidMetadataDataException instance
     */
    public static InvalidMetadataDataException unknownCode(String kind, int code) {
        return new InvalidMetadataDataException(
            String.format("Unknown %s 0x%02X", kind, code)
        );
    }
}
