package io.portmeta.metadata.api;

/**
 * Base exception for all portable metadata errors.
 * Provides contextual information to help with debugging.
 */
public class PortableMetadataException extends RuntimeException {
    private final String context;
    private final String errorCode;

    public PortableMetadataException(String message) {
        this(message, null, null);
    }

    public PortableMetadataException(String message, Throwable cause) {
        this(message, cause, null, null);
    }

    public PortableMetadataException(String message, String context, String errorCode) {
        this(message, null, context, errorCode);
    }

    public PortableMetadataException(
            String message, Throwable cause, String context, String errorCode) {
        super(formatMessage(message, context, errorCode), cause);
        this.context = context;
        this.errorCode = errorCode;
    }

    private static String formatMessage(String message, String context, String errorCode) {
        StringBuilder sb = new StringBuilder(message);
        if (context != null) {
            sb.append(" [Context: ").append(context).append("]");
        }
        if (errorCode != null) {
            sb.append(" [Error Code: ").append(errorCode).append("]");
        }
        return sb.toString();
    }

    public String getContext() {
        return context;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
