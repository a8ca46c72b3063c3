/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.transaction;

import static com.macstab.oss.kvspace.FutureAssertions.failure;
import static com.macstab.oss.kvspace.FutureAssertions.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.function.UnaryOperator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.kvspace.KvSpaceConfig;
import com.macstab.oss.kvspace.KvSpaceRuntime;
import com.macstab.oss.kvspace.backend.SchemaUpgrade;
import com.macstab.oss.kvspace.backend.TransactionMode;
import com.macstab.oss.kvspace.backend.memory.InMemoryBackendAdapter;
import com.macstab.oss.kvspace.coalesce.QueuedWrite;
import com.macstab.oss.kvspace.connection.ConnectionContext;
import com.macstab.oss.kvspace.connection.ConnectionState;
import com.macstab.oss.kvspace.connection.DatabaseIdentity;
import com.macstab.oss.kvspace.connection.StoreBinding;
import com.macstab.oss.kvspace.error.ErrorCode;
import com.macstab.oss.kvspace.error.ErrorDetails;

/**
 * Tests for {@link AdmissionController}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Real {@link ConnectionContext} over a private {@link InMemoryBackendAdapter}
 *   <li>Blocking transaction bodies (latches) to observe admission and queueing
 *   <li>Awaitility for counters that change on worker threads
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("AdmissionController")
class AdmissionControllerTest {

  private static final String DATABASE = "admission";
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private KvSpaceRuntime runtime;
  private InMemoryBackendAdapter adapter;

  @BeforeEach
  void setUp() {
    runtime = KvSpaceRuntime.create();
    adapter = new InMemoryBackendAdapter();
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  private ConnectionContext context() {
    return runtime
        .getConnections()
        .acquire(new DatabaseIdentity(adapter.getName(), DATABASE, null), adapter);
  }

  private StoreBinding initialized(
      final ConnectionContext context,
      final UnaryOperator<KvSpaceConfig.KvSpaceConfigBuilder> tune) {
    final var binding =
        new StoreBinding(
            tune.apply(KvSpaceConfig.builder().name(DATABASE).storeName("items")).build());
    result(context.initialize(binding));
    return binding;
  }

  private static <T> TransactionWork<T> awaiting(final CountDownLatch latch, final T value) {
    return transaction -> {
      latch.await();
      return value;
    };
  }

  @Nested
  @DisplayName("Admission")
  class Admission {

    @Test
    @DisplayName("should queue transactions beyond the configured maximum")
    void shouldQueueBeyondMaximum() {
      // Arrange
      final var context = context();
      final var binding = initialized(context, builder -> builder.maxConcurrentTransactions(1));
      final var admission = context.getAdmission();
      final var release = new CountDownLatch(1);

      // Act
      final var first =
          admission.execute(binding, TransactionMode.READ_ONLY, "first", awaiting(release, 1));
      await().atMost(TIMEOUT).until(() -> admission.getActiveCount() == 1);
      final var second =
          admission.execute(binding, TransactionMode.READ_ONLY, "second", transaction -> 2);

      // Assert
      await().atMost(TIMEOUT).until(() -> admission.getPendingCount() == 1);
      assertThat(second).isNotDone();

      release.countDown();
      assertThat(result(first)).isEqualTo(1);
      assertThat(result(second)).isEqualTo(2);
      await().atMost(TIMEOUT).until(() -> admission.getActiveCount() == 0);
      assertThat(admission.getPendingCount()).isZero();
    }

    @Test
    @DisplayName("should start queued transactions in FIFO order")
    void shouldStartQueuedTransactionsInFifoOrder() {
      // Arrange
      final var context = context();
      final var binding = initialized(context, builder -> builder.maxConcurrentTransactions(1));
      final var admission = context.getAdmission();
      final var release = new CountDownLatch(1);
      final List<Integer> started = new CopyOnWriteArrayList<>();

      final var blocker =
          admission.execute(binding, TransactionMode.READ_ONLY, "blocker", awaiting(release, 0));
      await().atMost(TIMEOUT).until(() -> admission.getActiveCount() == 1);

      // Act
      final var queued = new CompletableFuture<?>[3];
      for (int i = 0; i < queued.length; i++) {
        final int number = i + 1;
        queued[i] =
            admission.execute(
                binding,
                TransactionMode.READ_ONLY,
                "queued",
                transaction -> {
                  started.add(number);
                  return null;
                });
      }
      await().atMost(TIMEOUT).until(() -> admission.getPendingCount() == 3);
      release.countDown();
      result(CompletableFuture.allOf(queued));
      result(blocker);

      // Assert
      assertThat(started).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("should admit every transaction without a maximum")
    void shouldAdmitEveryTransactionWithoutMaximum() {
      // Arrange
      final var context = context();
      final var binding = initialized(context, UnaryOperator.identity());
      final var admission = context.getAdmission();
      final var release = new CountDownLatch(1);

      // Act
      final var first =
          admission.execute(binding, TransactionMode.READ_ONLY, "first", awaiting(release, 1));
      final var second =
          admission.execute(binding, TransactionMode.READ_ONLY, "second", awaiting(release, 2));

      // Assert
      await().atMost(TIMEOUT).until(() -> admission.getActiveCount() == 2);
      assertThat(admission.getPendingCount()).isZero();
      release.countDown();
      assertThat(result(first)).isEqualTo(1);
      assertThat(result(second)).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("should abort and report OPERATION_FAILED when the work throws")
    void shouldAbortWhenWorkThrows() {
      // Arrange
      final var context = context();
      final var binding = initialized(context, UnaryOperator.identity());
      final var admission = context.getAdmission();

      // Act
      final var error =
          failure(
              admission.execute(
                  binding,
                  TransactionMode.READ_WRITE,
                  "setItem",
                  transaction -> {
                    transaction.put("a", 1);
                    throw new IllegalStateException("boom");
                  }),
              ErrorCode.OPERATION_FAILED);

      // Assert
      assertThat(error.getDetail(ErrorDetails.OPERATION)).isEqualTo("setItem");
      assertThat(error.getDetail(ErrorDetails.STORE_NAME)).isEqualTo("items");
      assertThat(error.getDetail(ErrorDetails.TRANSACTION_MODE)).isEqualTo("READ_WRITE");
      assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
      final var length =
          admission.execute(
              binding, TransactionMode.READ_ONLY, "length", transaction -> transaction.count());
      assertThat(result(length)).isZero();
    }

    @Test
    @DisplayName("should report QUOTA_EXCEEDED when the backend rejects the commit")
    void shouldReportQuotaExceeded() {
      // Arrange
      adapter = new InMemoryBackendAdapter("tiny", 1);
      final var context = context();
      final var binding = initialized(context, UnaryOperator.identity());

      // Act + Assert
      failure(
          context
              .getAdmission()
              .execute(
                  binding,
                  TransactionMode.READ_WRITE,
                  "setItems",
                  transaction -> {
                    transaction.put("a", 1);
                    transaction.put("b", 2);
                    return null;
                  }),
          ErrorCode.QUOTA_EXCEEDED);
    }
  }

  @Nested
  @DisplayName("Stale Connections")
  class StaleConnections {

    @Test
    @DisplayName("should reconnect and retry after an external upgrade")
    void shouldReconnectAndRetry() {
      // Arrange
      final var context = context();
      final var binding = initialized(context, UnaryOperator.identity());
      adapter.open(DATABASE, 9, SchemaUpgrade.NONE).close();

      // Act
      final var value =
          result(
              context
                  .getAdmission()
                  .execute(binding, TransactionMode.READ_ONLY, "getItem", transaction -> "ok"));

      // Assert
      assertThat(value).isEqualTo("ok");
      assertThat(binding.getVersion()).isEqualTo(9);
    }

    @Test
    @DisplayName("should report DRIVER_UNAVAILABLE when retries are exhausted")
    void shouldReportDriverUnavailableWithoutRetries() {
      // Arrange
      final var context = context();
      final var binding = initialized(context, builder -> builder.transactionRetries(0));
      adapter.open(DATABASE, 9, SchemaUpgrade.NONE).close();

      // Act
      final var error =
          failure(
              context
                  .getAdmission()
                  .execute(binding, TransactionMode.READ_ONLY, "getItem", transaction -> "ok"),
              ErrorCode.DRIVER_UNAVAILABLE);

      // Assert
      assertThat(error.getDetail(ErrorDetails.DB_NAME)).isEqualTo(DATABASE);
    }
  }

  @Nested
  @DisplayName("Idle Close")
  class IdleClose {

    @Test
    @DisplayName("should close the connection after inactivity and reopen on next use")
    void shouldCloseAfterInactivityAndReopen() {
      // Arrange
      final var context = context();
      final var binding =
          initialized(context, builder -> builder.idleCloseAfter(Duration.ofMillis(50)));
      final var admission = context.getAdmission();

      // Act
      result(admission.execute(binding, TransactionMode.READ_ONLY, "length", transaction -> 0));

      // Assert
      await().atMost(TIMEOUT).until(() -> context.getState() == ConnectionState.CLOSED);
      assertThat(binding.isStale()).isTrue();
      assertThat(admission.isIdleCloseScheduled()).isFalse();

      final var reopened =
          result(admission.execute(binding, TransactionMode.READ_ONLY, "keys", transaction -> 7));
      assertThat(reopened).isEqualTo(7);
      assertThat(binding.isStale()).isFalse();
    }

    @Test
    @DisplayName("should cancel the idle timer when new activity starts")
    void shouldCancelIdleTimerOnNewActivity() {
      // Arrange
      final var context = context();
      final var binding =
          initialized(context, builder -> builder.idleCloseAfter(Duration.ofMillis(200)));
      final var admission = context.getAdmission();
      result(admission.execute(binding, TransactionMode.READ_ONLY, "length", transaction -> 0));
      assertThat(admission.isIdleCloseScheduled()).isTrue();
      final var latch = new CountDownLatch(1);

      // Act
      final var running =
          admission.execute(binding, TransactionMode.READ_WRITE, "setItem", awaiting(latch, 1));

      // Assert
      assertThat(admission.isIdleCloseScheduled()).isFalse();
      await()
          .during(Duration.ofMillis(400))
          .atMost(TIMEOUT)
          .until(() -> context.getState() == ConnectionState.OPEN && !running.isDone());
      assertThat(binding.isStale()).isFalse();

      latch.countDown();
      assertThat(result(running)).isEqualTo(1);
      assertThat(admission.isIdleCloseScheduled()).isTrue();
    }

    @Test
    @DisplayName("should reschedule instead of closing while coalesced writes are buffered")
    void shouldRescheduleWhileWritesAreBuffered() {
      // Arrange
      final var context = context();
      final var binding =
          initialized(
              context,
              builder ->
                  builder
                      .idleCloseAfter(Duration.ofMillis(50))
                      .coalesceWindow(Duration.ofSeconds(30)));
      final var admission = context.getAdmission();
      result(admission.execute(binding, TransactionMode.READ_ONLY, "length", transaction -> 0));
      final var write = QueuedWrite.set(binding, "buffered", true);

      // Act
      context.getCoalescer().enqueue(write);

      // Assert
      assertThat(context.hasPendingWork()).isTrue();
      await()
          .during(Duration.ofMillis(300))
          .atMost(TIMEOUT)
          .until(
              () ->
                  context.getState() == ConnectionState.OPEN
                      && admission.isIdleCloseScheduled());

      result(context.getCoalescer().flush());
      assertThat(write.getCompletion()).isCompleted();
      await().atMost(TIMEOUT).until(() -> context.getState() == ConnectionState.CLOSED);
    }

    @Test
    @DisplayName("should not schedule idle close when disabled")
    void shouldNotScheduleWhenDisabled() {
      // Arrange
      final var context = context();
      final var binding = initialized(context, UnaryOperator.identity());
      final var admission = context.getAdmission();

      // Act
      result(admission.execute(binding, TransactionMode.READ_ONLY, "length", transaction -> 0));

      // Assert
      assertThat(admission.isIdleCloseScheduled()).isFalse();
      assertThat(context.getState()).isEqualTo(ConnectionState.OPEN);
    }
  }
}
