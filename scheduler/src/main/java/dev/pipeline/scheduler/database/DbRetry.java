package dev.pipeline.scheduler.database;

import dev.pipeline.scheduler.exceptions.SchedulerDatabaseException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs store operations, retrying transient SQL failures with jittered exponential backoff.
 *
 * <p>Reads and idempotent writes go through {@link #call}. Writes that must not be applied twice,
 * such as inserting a run or recording an attempt, go through {@link #callOnce}: they are retried
 * only when the failure proves the transaction did not commit.
 *
 * <p>Backoff sleeps end on interrupt. The interrupt flag is restored and the last failure is
 * thrown, so stopping the scheduler loop or the launch pool does not wait out the retries.
 */
public final class DbRetry {
  private static final Logger logger = LoggerFactory.getLogger(DbRetry.class);

  private DbRetry() {}

  record Options(
      Duration initialBackoff,
      Duration maxBackoff,
      int maxAttempts,
      Predicate<Throwable> retriablePredicate) {
    static Options defaults() {
      return new Options(
          Duration.ofSeconds(1), Duration.ofSeconds(30), 8, DbRetry::isRetriableSql);
    }

    static Options nonIdempotent() {
      return defaults().withRetriable(DbRetry::isRetriableBeforeCommit);
    }

    Options withInitialBackoff(Duration d) {
      return new Options(Objects.requireNonNull(d), maxBackoff, maxAttempts, retriablePredicate);
    }

    Options withMaxAttempts(int n) {
      return new Options(initialBackoff, maxBackoff, n, retriablePredicate);
    }

    Options withRetriable(Predicate<Throwable> p) {
      return new Options(initialBackoff, maxBackoff, maxAttempts, Objects.requireNonNull(p));
    }
  }

  /** Reads and idempotent writes: backoff 1s..30s, up to 8 attempts on transient SQL failures. */
  public static <T> T call(ThrowingSupplier<T, Exception> body) {
    return call(body, Options.defaults());
  }

  /** Writes that must not be applied twice; see {@link #isRetriableBeforeCommit}. */
  public static <T> T callOnce(ThrowingSupplier<T, Exception> body) {
    return call(body, Options.nonIdempotent());
  }

  public static <E extends Exception> void run(ThrowingRunnable<E> body) {
    call(
        () -> {
          body.execute();
          return null;
        });
  }

  public static <E extends Exception> void runOnce(ThrowingRunnable<E> body) {
    callOnce(
        () -> {
          body.execute();
          return null;
        });
  }

  static <T, E extends Exception> T call(ThrowingSupplier<T, E> body, Options opts) {
    Objects.requireNonNull(body);
    Objects.requireNonNull(opts);

    int maxAttempts = Math.max(1, opts.maxAttempts());
    Duration backoff = opts.initialBackoff();

    for (int attempt = 1; ; attempt++) {
      try {
        return body.execute();
      } catch (Throwable t) {
        if (!opts.retriablePredicate().test(t)) {
          throw wrapUnchecked(t);
        }
        if (attempt >= maxAttempts) {
          logger.error("Store operation failed after {} attempts", maxAttempts, t);
          throw new SchedulerDatabaseException(t);
        }

        // jitter: backoff * (0.5 .. 1.5)
        double jitterFactor = 0.5 + ThreadLocalRandom.current().nextDouble();
        long sleepMillis = Math.max(1L, (long) (backoff.toMillis() * jitterFactor));

        logger.warn(
            "Store operation failed (attempt {} of {}): {}. Retrying in {} ms",
            attempt,
            maxAttempts,
            t.getMessage(),
            sleepMillis);

        try {
          if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException();
          }
          Thread.sleep(sleepMillis);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          logger.info("Store operation retry abandoned after {} attempts: interrupted", attempt);
          var e = new SchedulerDatabaseException(t);
          e.addSuppressed(ie);
          throw e;
        }

        long next = Math.min(backoff.toMillis() * 2, opts.maxBackoff().toMillis());
        backoff = Duration.ofMillis(next);
      }
    }
  }

  private static RuntimeException wrapUnchecked(Throwable t) {
    return (t instanceof RuntimeException re) ? re : new SchedulerDatabaseException(t);
  }

  /**
   * Transient failures: SQLTransientException and SQLRecoverableException, SQL state classes 08
   * (connection) and 40 (transaction rollback), plus Postgres 55P03 lock_not_available, 53300
   * too_many_connections and 57014 query_canceled.
   */
  static boolean isRetriableSql(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) {
        return true;
      }
      if (cur instanceof SQLException sqlEx) {
        String state = sqlEx.getSQLState();
        if (state == null) continue;

        if (state.startsWith("08")) return true;
        if (state.startsWith("40")) return true;
        if (state.equals("55P03")) return true;
        if (state.equals("53300")) return true;
        if (state.equals("57014")) return true;
      }
    }
    return false;
  }

  /**
   * Transient failures after which the transaction is known not to have committed: no connection
   * could be obtained (pool timeout, 08001, 08004, 53300), or the server rolled the transaction
   * back (class 40, 55P03, 57014). A connection lost mid-transaction leaves the outcome unknown
   * and is not retried.
   */
  static boolean isRetriableBeforeCommit(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof SQLTransientConnectionException) {
        return true;
      }
      if (cur instanceof SQLException sqlEx) {
        String state = sqlEx.getSQLState();
        if (state == null) continue;

        if (state.equals("08001") || state.equals("08004")) return true;
        if (state.startsWith("40")) return true;
        if (state.equals("55P03")) return true;
        if (state.equals("53300")) return true;
        if (state.equals("57014")) return true;
        if (state.startsWith("08")) return false;
      }
    }
    return false;
  }
}
