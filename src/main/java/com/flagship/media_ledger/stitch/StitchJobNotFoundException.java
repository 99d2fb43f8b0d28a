package com.flagship.media_ledger.stitch;

import com.flagship.media_ledger.common.exception.ResourceNotFoundException;

import java.util.UUID;

public class StitchJobNotFoundException extends ResourceNotFoundException {

    public StitchJobNotFoundException(UUID id) {
        super("Stitch job not found: " + id);
    }
}
