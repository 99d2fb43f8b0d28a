package com.flagship.media_ledger.creation;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Token cost per creation kind.
 */
@Component
public class CreationPricing {

    private final long imageCost;
    private final long videoCost;

    public CreationPricing(@Value("${media.cost.image:1}") long imageCost,
                           @Value("${media.cost.video:10}") long videoCost) {
        if (imageCost <= 0 || videoCost <= 0) {
            throw new IllegalArgumentException("Creation costs must be positive");
        }
        this.imageCost = imageCost;
        this.videoCost = videoCost;
    }

    public long costOf(CreationKind kind) {
        return switch (kind) {
            case IMAGE -> imageCost;
            case VIDEO -> videoCost;
        };
    }
}
