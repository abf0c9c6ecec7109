package com.brokerage.revshare.exception;

/**
 * Thrown when a referenced agent or transaction does not exist
 */
public class ResourceNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException agent(Long id) {
        return new ResourceNotFoundException("Agent not found: " + id);
    }

    public static ResourceNotFoundException transaction(Long id) {
        return new ResourceNotFoundException("Transaction not found: " + id);
    }
}
