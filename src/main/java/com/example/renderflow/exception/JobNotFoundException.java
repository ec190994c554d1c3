package com.example.renderflow.exception;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String id) {
        super("Render job not found: " + id);
    }
}
