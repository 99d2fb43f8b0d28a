package com.flagship.media_ledger.creation;

import com.flagship.media_ledger.common.exception.ResourceNotFoundException;

import java.util.UUID;

public class CreationNotFoundException extends ResourceNotFoundException {

    public CreationNotFoundException(UUID id) {
        super("Creation not found: " + id);
    }
}
