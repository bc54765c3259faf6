package com.lnradar.ingestion.classifier;

import com.lnradar.domain.ClassifiedEvent;

import java.util.Optional;

/**
 * Either a classified event or the reason the record was skipped.
 */
public record Classification(ClassifiedEvent event, SkipReason skipReason) {

    public static Classification of(ClassifiedEvent event) {
        return new Classification(event, null);
    }

    public static Classification skip(SkipReason reason) {
        return new Classification(null, reason);
    }

    public boolean isSkipped() {
        return event == null;
    }

    public Optional<ClassifiedEvent> asEvent() {
        return Optional.ofNullable(event);
    }
}
