package com.prediction.market.options_market.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.prediction.market.options_market.entity.OptionQuote;
import com.prediction.market.options_market.entity.QuoteSet;

class QuoteStoreTest {

  @Test
  void replacesWholeSets() {
    QuoteStore store = new QuoteStore();
    assertThat(store.getCurrent()).isEmpty();

    store.replace(new QuoteSet(0, 80.0, List.of(new OptionQuote(0.5, 0.4, 0.4))));
    store.replace(new QuoteSet(1, 70.0, List.of(new OptionQuote(0.5, 0.35, 0.35), new OptionQuote(0.3, 0.49, 0.49))));

    QuoteSet current = store.getCurrent().orElseThrow();
    assertThat(current.getSequenceIndex()).isEqualTo(1);
    assertThat(current.getQuotes()).hasSize(2);
    assertThat(current.find(0.1 + 0.2)).map(OptionQuote::getBid).contains(0.49);
    assertThat(current.find(0.6)).isEmpty();
  }
}
