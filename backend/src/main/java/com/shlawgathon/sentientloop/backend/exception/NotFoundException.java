package com.shlawgathon.sentientloop.backend.exception;

public class NotFoundException extends GovernanceException {

    public NotFoundException(String entity, String id) {
        super(entity + " not found: " + id);
    }
}
