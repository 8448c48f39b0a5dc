package com.prediction.market.options_market.cache;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import com.prediction.market.options_market.entity.QuoteSet;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the latest quote set. Readers always see one complete set.
 */
@Slf4j
public class QuoteStore {
    private final AtomicReference<QuoteSet> current = new AtomicReference<>();

    public Optional<QuoteSet> getCurrent() {
        return Optional.ofNullable(current.get());
    }

    public void replace(QuoteSet quoteSet) {
        QuoteSet previous = current.getAndSet(quoteSet);
        if (previous != null && previous.getSequenceIndex() > quoteSet.getSequenceIndex()) {
            log.debug("Quote set sequence went backwards: {} -> {}",
                previous.getSequenceIndex(), quoteSet.getSequenceIndex());
        }
    }
}
