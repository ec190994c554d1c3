package com.example.renderflow.exception;

public class DuplicateJobIdException extends RuntimeException {
    public DuplicateJobIdException(String id) {
        super("Render job already exists: " + id);
    }
}
