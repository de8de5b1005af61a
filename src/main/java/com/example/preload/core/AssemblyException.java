package com.example.preload.core;

/**
 * Raised by an {@link Assembler} that could not build a value. The reason ends up in the key's
 * {@link LoadStatus}.
 */
public class AssemblyException extends Exception {

    private final String reason;

    public AssemblyException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public AssemblyException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
