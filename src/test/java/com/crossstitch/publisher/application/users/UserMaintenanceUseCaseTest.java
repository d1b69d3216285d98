package com.crossstitch.publisher.application.users;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.application.campaign.UsersSchema;
import com.crossstitch.publisher.application.port.ClockPort;
import com.crossstitch.publisher.domain.error.StoreException;
import com.crossstitch.publisher.testing.InMemoryItemStore;
import com.crossstitch.publisher.testing.RecordingProgress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UserMaintenanceUseCaseTest {
  private static final String USERS = "CrossStitchUsers";
  private static final String ITEMS = "CrossStitchItems";

  @TempDir Path tempDir;

  private RecordingProgress progress;
  private ClockPort clock;

  @BeforeEach
  void setUp() {
    progress = new RecordingProgress();
    AtomicLong ticks = new AtomicLong();
    clock = () -> ticks.addAndGet(1_000);
  }

  @Test
  void unsubscribeFieldsAreAddedOnlyWhereMissing() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(USERS, "ID").pageSize(2);
    store.seed(USERS, Map.of("ID", "u1", "Email", "a@example.com"));
    store.seed(USERS, Map.of("ID", "u2", "UnsubscribeToken", "keep", "Unsubscribed", true));
    store.seed(USERS, Map.of("ID", "u3", "UnsubscribeToken", " ", "Unsubscribed", false));
    store.seed(USERS, Map.of("Email", "orphan@example.com"));
    UserMaintenanceUseCase useCase = useCase(store);

    MaintenanceReport report = useCase.initUnsubscribeFields();

    assertEquals(new MaintenanceReport(4, 2, 1, 1, 0), report);
    Map<String, Object> u1 = store.find(USERS, Map.of("ID", "u1")).orElseThrow();
    assertEquals("tok-1", u1.get("UnsubscribeToken"));
    assertEquals(Boolean.FALSE, u1.get("Unsubscribed"));
    assertEquals("keep", store.find(USERS, Map.of("ID", "u2")).orElseThrow().get("UnsubscribeToken"));
    assertEquals(Boolean.TRUE, store.find(USERS, Map.of("ID", "u2")).orElseThrow().get("Unsubscribed"));
    assertEquals("tok-2", store.find(USERS, Map.of("ID", "u3")).orElseThrow().get("UnsubscribeToken"));
    assertTrue(progress.anyContains("Updated 2 user(s), skipped 1 user(s)."));
  }

  @Test
  void unsubscribePassIsRepeatable() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(USERS, "ID");
    store.seed(USERS, Map.of("ID", "u1"));
    UserMaintenanceUseCase useCase = useCase(store);

    useCase.initUnsubscribeFields();
    MaintenanceReport second = useCase.initUnsubscribeFields();

    assertEquals(new MaintenanceReport(1, 0, 1, 0, 0), second);
    assertEquals("tok-1", store.find(USERS, Map.of("ID", "u1")).orElseThrow().get("UnsubscribeToken"));
  }

  @Test
  void cidFieldsAreKeyedByIdAndSortKey() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(USERS, "ID", "NPage");
    store.seed(USERS, Map.of("ID", "u1", "NPage", "USER"));
    store.seed(USERS, Map.of("ID", "u2", "NPage", "USER", "cid", "existing"));
    store.seed(USERS, Map.of("ID", "u3"));
    store.seed(USERS, Map.of("Email", "orphan@example.com"));

    MaintenanceReport report = useCase(store).initCidFields();

    assertEquals(new MaintenanceReport(4, 1, 1, 1, 0), report);
    assertEquals("cid-1", store.find(USERS, Map.of("ID", "u1", "NPage", "USER")).orElseThrow().get("cid"));
    assertEquals("existing", store.find(USERS, Map.of("ID", "u2", "NPage", "USER")).orElseThrow().get("cid"));
    assertTrue(progress.anyContains("[CrossStitchUsers] Total users found: 4."));
    assertTrue(progress.anyContains(
        "[CrossStitchUsers] cid initialization finished. Scanned 4, updated 1, skipped 1, missing NPage 1."));
  }

  @Test
  void cidPassReportsProgressEveryFiftyUsers() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(USERS, "ID", "NPage").pageSize(20);
    for (int i = 0; i < 50; i++) {
      store.seed(USERS, Map.of("ID", "u" + i, "NPage", "USER"));
    }

    useCase(store).initCidFields();

    assertTrue(progress.anyContains("Scanned 50, updated 50, skipped 0, missing NPage 0. Remaining ~0."));
  }

  @Test
  void emptyTableReportsUnknownTotal() throws Exception {
    MaintenanceReport report = useCase(new InMemoryItemStore()).initCidFields();

    assertEquals(new MaintenanceReport(0, 0, 0, 0, 0), report);
    assertTrue(progress.anyContains("Could not determine total users (count returned 0)."));
  }

  @Test
  void updateFailurePropagates() {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(USERS, "ID");
    store.seed(USERS, Map.of("ID", "u1"));
    store.fail("update");

    assertThrows(StoreException.class, () -> useCase(store).initUnsubscribeFields());
  }

  @Test
  void itemsCidPassOnlyTouchesUserItems() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(ITEMS, "ID", "NPage");
    store.seed(ITEMS, Map.of("ID", "USR#ann@example.com", "NPage", "0001"));
    store.seed(ITEMS, Map.of("ID", "USR#bob@example.com", "NPage", "0001", "cid", "existing"));
    store.seed(ITEMS, Map.of("ID", "USR#cara@example.com"));
    store.seed(ITEMS, Map.of("ID", "ALB#0007", "NPage", "0001"));

    MaintenanceReport report = useCase(store).initItemsCidFields(ITEMS);

    assertEquals(new MaintenanceReport(3, 1, 1, 1, 0), report);
    assertEquals("cid-1",
        store.find(ITEMS, Map.of("ID", "USR#ann@example.com", "NPage", "0001")).orElseThrow().get("cid"));
    assertFalse(store.find(ITEMS, Map.of("ID", "ALB#0007", "NPage", "0001")).orElseThrow().containsKey("cid"));
    assertTrue(progress.anyContains("[CrossStitchItems] Total users found: 3."));
  }

  @Test
  void markVerifiedCopiesCreatedAtWhereNotYetVerified() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(USERS, "ID");
    store.seed(USERS, Map.of("ID", "u1", "CreatedAt", "2024-01-02T03:04:05Z"));
    store.seed(USERS, Map.of("ID", "u2", "CreatedAt", "2023-01-01", "Verified", true, "VerifiedAt", "2023-02-02"));
    store.seed(USERS, Map.of("ID", "u3", "CreatedAt", "2022-05-06", "Verified", true, "VerifiedAt", " "));
    store.seed(USERS, Map.of("ID", "u4", "Verified", false));

    MaintenanceReport report = useCase(store).markVerified();

    assertEquals(new MaintenanceReport(4, 2, 1, 1, 0), report);
    Map<String, Object> u1 = store.find(USERS, Map.of("ID", "u1")).orElseThrow();
    assertEquals(Boolean.TRUE, u1.get("Verified"));
    assertEquals("2024-01-02T03:04:05Z", u1.get("VerifiedAt"));
    assertEquals("2022-05-06", store.find(USERS, Map.of("ID", "u3")).orElseThrow().get("VerifiedAt"));
    assertEquals("2023-02-02", store.find(USERS, Map.of("ID", "u2")).orElseThrow().get("VerifiedAt"));
    assertEquals(Boolean.FALSE, store.find(USERS, Map.of("ID", "u4")).orElseThrow().get("Verified"));
    assertTrue(progress.anyContains("CrossStitchUsers: total users 4."));
    assertTrue(progress.anyContains(
        "[Verify] Done. Scanned 4, updated 2, already verified 1, missing CreatedAt 1, errors 0."));
  }

  @Test
  void markVerifiedCountsFailedUpdatesAndKeepsGoing() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(USERS, "ID");
    store.seed(USERS, Map.of("ID", "u1", "CreatedAt", "2024-01-02"));
    store.seed(USERS, Map.of("ID", "u2", "CreatedAt", "2024-01-03"));
    store.fail("update");

    MaintenanceReport report = useCase(store).markVerified();

    assertEquals(new MaintenanceReport(2, 0, 0, 0, 2), report);
    assertEquals(2, store.countOf("update"));
    assertTrue(progress.anyContains("[Verify] Failed to update u1: Injected update failure"));
    assertTrue(progress.anyContains("[Verify] Failed to update u2: Injected update failure"));
  }

  @Test
  void removeSuppressedDeletesEveryAddressableUserItem() {
    InMemoryItemStore store = suppressionFixture();

    SuppressionReport report = useCase(store).removeSuppressed(
        List.of("ann@example.com", "bob@example.com", "cara@example.com"), ITEMS, false);

    assertEquals(new SuppressionReport(3, 2, 1, 1, 0, false), report);
    assertTrue(store.find(ITEMS, Map.of("ID", "USR#ann@example.com", "NPage", "0001")).isEmpty());
    assertTrue(store.find(ITEMS, Map.of("ID", "USR#ann@example.com", "NPage", "0002")).isEmpty());
    assertEquals(3, store.items(ITEMS).size());
    assertTrue(progress.anyContains("[Suppress] Processed 3/3 | Deleted 2, Missing 1, Missing NPage 1, Errors 0. "
        + "Elapsed 00:00:01, ETA 00:00:00, Remaining 0 (0.0% left)."));
    assertTrue(progress.anyContains(
        "[Suppress] Done. Deleted 2, Missing 1, Missing NPage 1, Errors 0. Total time 00:00:02."));
  }

  @Test
  void removeSuppressedDryRunDeletesNothing() {
    InMemoryItemStore store = suppressionFixture();

    SuppressionReport report = useCase(store).removeSuppressed(List.of("ann@example.com"), ITEMS, true);

    assertEquals(new SuppressionReport(1, 2, 0, 0, 0, true), report);
    assertEquals(0, store.countOf("delete"));
    assertEquals(5, store.items(ITEMS).size());
    assertTrue(progress.anyContains("[dry-run] [Suppress] Done. Would delete 2"));
  }

  @Test
  void removeSuppressedCountsLookupFailuresPerEmail() {
    InMemoryItemStore store = suppressionFixture().fail("query");

    SuppressionReport report =
        useCase(store).removeSuppressed(List.of("ann@example.com", "bob@example.com"), ITEMS, false);

    assertEquals(new SuppressionReport(2, 0, 0, 0, 2, false), report);
    assertEquals(5, store.items(ITEMS).size());
    assertTrue(progress.anyContains("[Suppress] Error for ann@example.com: Injected query failure"));
  }

  @Test
  void suppressionProgressEstimatesRemainingTime() {
    String line = UserMaintenanceUseCase.suppressionLine("[Suppress]", 50, 200, 40, 8, 2, 0, 100_000);

    assertEquals("[Suppress] Processed 50/200 | Deleted 40, Missing 8, Missing NPage 2, Errors 0. "
        + "Elapsed 00:01:40, ETA 00:05:00, Remaining 150 (75.0% left).", line);
  }

  @Test
  void suppressedListKeepsEveryThirdLine() throws Exception {
    Path file = tempDir.resolve("suppressed.txt");
    Files.write(file, ("\uFEFFann@example.com\r\nHard bounce\r\n2024-01-01\r\n"
        + "  \r\nComplaint\r\n2024-01-02\r\n"
        + " bob@example.com \r\nUnsubscribed\r\n2024-01-03").getBytes(StandardCharsets.UTF_8));

    assertEquals(List.of("ann@example.com", "bob@example.com"), UserMaintenanceUseCase.readSuppressedEmails(file));
  }

  @Test
  void missingSuppressedListIsReported() {
    assertThrows(NoSuchFileException.class,
        () -> UserMaintenanceUseCase.readSuppressedEmails(tempDir.resolve("absent.txt")));
  }

  private static InMemoryItemStore suppressionFixture() {
    InMemoryItemStore store = new InMemoryItemStore().keyedBy(ITEMS, "ID", "NPage");
    store.seed(ITEMS, Map.of("ID", "USR#ann@example.com", "NPage", "0001"));
    store.seed(ITEMS, Map.of("ID", "USR#ann@example.com", "NPage", "0002"));
    store.seed(ITEMS, Map.of("ID", "USR#bob@example.com"));
    store.seed(ITEMS, Map.of("ID", "USR#dan@example.com", "NPage", "0001"));
    store.seed(ITEMS, Map.of("ID", "ALB#0007", "NPage", "0001"));
    return store;
  }

  private UserMaintenanceUseCase useCase(InMemoryItemStore store) {
    return new UserMaintenanceUseCase(store, UsersSchema.withTable(USERS), progress, clock, counter("tok-"),
        counter("cid-"));
  }

  private static Supplier<String> counter(String prefix) {
    AtomicInteger next = new AtomicInteger();
    return () -> prefix + next.incrementAndGet();
  }
}
