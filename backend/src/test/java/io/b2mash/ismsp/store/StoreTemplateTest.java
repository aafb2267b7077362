package io.b2mash.ismsp.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.ismsp.exception.ErrorKind;
import io.b2mash.ismsp.exception.NotFoundException;
import io.b2mash.ismsp.exception.StorageException;
import io.b2mash.ismsp.testutil.TestStore;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

class StoreTemplateTest {

  @TempDir Path tempDir;

  private TestStore testStore;
  private StoreTemplate store;

  @BeforeEach
  void setUp() {
    testStore = TestStore.open(tempDir);
    store = testStore.store();
    testStore.jdbc().sql("CREATE TABLE counter (n INTEGER NOT NULL)").update();
  }

  @AfterEach
  void tearDown() {
    testStore.close();
  }

  @Test
  void execute_commitsOnSuccess() {
    store.executeWithoutResult(
        "insert", jdbc -> jdbc.sql("INSERT INTO counter (n) VALUES (1)").update());

    assertThat(rows()).isEqualTo(1);
  }

  @Test
  void execute_rollsBackOnException() {
    assertThatThrownBy(
            () ->
                store.executeWithoutResult(
                    "insert",
                    jdbc -> {
                      jdbc.sql("INSERT INTO counter (n) VALUES (1)").update();
                      throw new NotFoundException("Requirement", "9.9.9");
                    }))
        .isInstanceOf(NotFoundException.class);

    assertThat(rows()).isZero();
  }

  @Test
  void execute_nestedCallJoinsOuterTransaction() {
    assertThatThrownBy(
            () ->
                store.executeWithoutResult(
                    "outer",
                    outer -> {
                      store.executeWithoutResult(
                          "inner",
                          inner -> inner.sql("INSERT INTO counter (n) VALUES (1)").update());
                      throw new IllegalStateException("outer failed");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(rows()).isZero();
  }

  @Test
  void execute_retriesContentionUntilItClears() {
    var attempts = new AtomicInteger();

    var result =
        store.execute(
            "busy",
            jdbc -> {
              if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("database is locked");
              }
              return "done";
            });

    assertThat(result).isEqualTo("done");
    assertThat(attempts).hasValue(3);
  }

  @Test
  void execute_persistentContention_surfacesAsStorageError() {
    var attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                store.execute(
                    "busy",
                    jdbc -> {
                      attempts.incrementAndGet();
                      throw new CannotAcquireLockException("database is locked");
                    }))
        .isInstanceOfSatisfying(
            StorageException.class,
            e -> assertThat(e.getDetail()).contains("busy").contains("did not complete"));
    assertThat(attempts).hasValue(4);
  }

  @Test
  void execute_constraintViolation_isStorageErrorWithoutRetry() {
    var attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                store.executeWithoutResult(
                    "insert-null",
                    jdbc -> {
                      attempts.incrementAndGet();
                      jdbc.sql("INSERT INTO counter (n) VALUES (NULL)").update();
                    }))
        .isInstanceOfSatisfying(
            StorageException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.STORAGE_ERROR));
    assertThat(attempts).hasValue(1);
  }

  @Test
  void isContention_recognizesSqliteBusyAndLocked() {
    var busy =
        new SQLiteException("[SQLITE_BUSY] database is locked", SQLiteErrorCode.SQLITE_BUSY);
    var lockedSharedCache =
        new SQLiteException(
            "[SQLITE_LOCKED_SHAREDCACHE] table locked", SQLiteErrorCode.SQLITE_LOCKED_SHAREDCACHE);
    var constraint =
        new SQLiteException(
            "[SQLITE_CONSTRAINT_NOTNULL] NOT NULL constraint failed",
            SQLiteErrorCode.SQLITE_CONSTRAINT_NOTNULL);

    assertThat(StoreTemplate.isContention(new UncategorizedSQLException("x", "sql", busy)))
        .isTrue();
    assertThat(
            StoreTemplate.isContention(
                new UncategorizedSQLException("x", "sql", lockedSharedCache)))
        .isTrue();
    assertThat(StoreTemplate.isContention(new UncategorizedSQLException("x", "sql", constraint)))
        .isFalse();
    assertThat(
            StoreTemplate.isContention(
                new DataIntegrityViolationException("x", new SQLException("SQLITE_BUSY"))))
        .isTrue();
  }

  private long rows() {
    return testStore.jdbc().sql("SELECT COUNT(*) FROM counter").query(Long.class).single();
  }
}
