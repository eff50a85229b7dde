package io.portmeta.metadata.api;

/**
 * Exception thrown for metadata constructs that the portable representation cannot express,
 * such as varargs call sites or references into other modules.
 */
public class UnsupportedMetadataException extends PortableMetadataException {

    public UnsupportedMetadataException(String message) {
        super(message, null, "UNSUPPORTED");
    }

    public UnsupportedMetadataException(String message, String context) {
        super(message, context, "UNSUPPORTED");
    }
}
