package com.prediction.market.options_market.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.prediction.market.options_market.entity.PricePoint;

class QueuedPriceSinkTest {

  private static PricePoint point(long index) {
    return PricePoint.builder()
        .sequenceIndex(index)
        .timestamp(Instant.EPOCH)
        .price(50.0)
        .volume(100)
        .bidAskSpread(0.5)
        .build();
  }

  @Test
  void deliversInOrderOnItsOwnThread() {
    List<Long> received = new CopyOnWriteArrayList<>();
    List<String> threads = new CopyOnWriteArrayList<>();
    QueuedPriceSink sink = new QueuedPriceSink("orders", p -> {
      received.add(p.getSequenceIndex());
      threads.add(Thread.currentThread().getName());
    }, 100);

    for (long i = 0; i < 20; i++) {
      sink.onPrice(point(i));
    }
    sink.close();

    assertThat(received).hasSize(20).isSorted();
    assertThat(threads).allMatch(name -> name.equals("price-sink-orders"));
  }

  @Test
  void dropsWhenQueueIsFull() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    List<Long> received = new CopyOnWriteArrayList<>();
    QueuedPriceSink sink = new QueuedPriceSink("slow", p -> {
      started.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      received.add(p.getSequenceIndex());
    }, 2);

    sink.onPrice(point(0));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    sink.onPrice(point(1));
    sink.onPrice(point(2));
    sink.onPrice(point(3));

    assertThat(sink.getDroppedCount()).isEqualTo(1);
    assertThat(sink.getQueuedCount()).isEqualTo(2);

    release.countDown();
    sink.close();
    assertThat(received).containsExactly(0L, 1L, 2L);
  }

  @Test
  void delegateFailureDoesNotStopDelivery() {
    List<Long> received = new CopyOnWriteArrayList<>();
    QueuedPriceSink sink = new QueuedPriceSink("flaky", p -> {
      if (p.getSequenceIndex() == 1) {
        throw new IllegalStateException("boom");
      }
      received.add(p.getSequenceIndex());
    }, 10);

    sink.onPrice(point(0));
    sink.onPrice(point(1));
    sink.onPrice(point(2));
    sink.close();

    assertThat(received).containsExactly(0L, 2L);
  }

  @Test
  void closedSinkDropsQuietly() {
    QueuedPriceSink sink = new QueuedPriceSink("closed", p -> { }, 1);
    sink.close();

    sink.onPrice(point(0));

    assertThat(sink.getDroppedCount()).isEqualTo(1);
    assertThatThrownBy(() -> new QueuedPriceSink("bad", p -> { }, 0)).isInstanceOf(IllegalArgumentException.class);
  }
}
