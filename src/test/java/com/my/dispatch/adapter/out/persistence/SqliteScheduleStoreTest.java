package com.my.dispatch.adapter.out.persistence;

import com.my.dispatch.domain.exception.ScheduleNotFoundException;
import com.my.dispatch.domain.exception.StaleWriteException;
import com.my.dispatch.domain.model.AttendeeResponse;
import com.my.dispatch.domain.model.AwaitingCursor;
import com.my.dispatch.domain.model.Confirmation;
import com.my.dispatch.domain.model.ConfirmationMethod;
import com.my.dispatch.domain.model.ConfirmationState;
import com.my.dispatch.domain.model.DateRange;
import com.my.dispatch.domain.model.Schedule;
import com.my.dispatch.domain.model.Technician;
import com.my.dispatch.domain.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteScheduleStoreTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 1);
    private static final Instant T0 = Instant.parse("2026-02-20T08:00:00Z");
    private static final Technician ALEX = new Technician("tech-a", "Alex", "alex@example.com");
    private static final Technician BEA = new Technician("tech-b", "Bea", "bea@example.com");

    @TempDir
    Path tempDir;

    private SqliteScheduleStore store;

    @BeforeEach
    void setUp() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("dispatch.db").toAbsolutePath());
        store = new SqliteScheduleStore(dataSource);
        store.init();
    }

    @Test
    void insertStartsAtVersionOneAndReadsBack() {
        Schedule inserted = store.insert(draft("s-1", ALEX, 9, T0));

        Schedule loaded = store.findById("s-1").orElseThrow();

        assertThat(inserted.version()).isEqualTo(1);
        assertThat(loaded.version()).isEqualTo(1);
        assertThat(loaded.technician()).isEqualTo(ALEX);
        assertThat(loaded.window()).isEqualTo(window(9));
        assertThat(loaded.confirmationState()).isEqualTo(ConfirmationState.DRAFT);
        assertThat(loaded.technicianResponse()).isEqualTo(AttendeeResponse.NONE);
        assertThat(loaded.createdAt()).isEqualTo(T0);
        assertThat(store.findById("missing")).isEmpty();
    }

    @Test
    void updateKeepsEveryConfirmationField() {
        Schedule inserted = store.insert(draft("s-1", ALEX, 9, T0));
        Instant accepted = T0.plusSeconds(60);
        Instant confirmed = T0.plusSeconds(120);
        Schedule next = inserted.toBuilder()
                .confirmationState(ConfirmationState.CONFIRMED)
                .externalEventRef("evt-1")
                .selfAssigned(true)
                .technicianResponse(AttendeeResponse.ACCEPTED)
                .technicianAcceptedAt(accepted)
                .confirmation(new Confirmation(confirmed, "dispatcher-7", ConfirmationMethod.MANUAL_OVERRIDE))
                .lastResponseCheckAt(accepted)
                .updatedAt(confirmed)
                .build();

        Schedule saved = store.update(next, 1);
        Schedule loaded = store.findById("s-1").orElseThrow();

        assertThat(saved.version()).isEqualTo(2);
        assertThat(loaded.version()).isEqualTo(2);
        assertThat(loaded.confirmationState()).isEqualTo(ConfirmationState.CONFIRMED);
        assertThat(loaded.externalEventRef()).isEqualTo("evt-1");
        assertThat(loaded.selfAssigned()).isTrue();
        assertThat(loaded.technicianAcceptedAt()).isEqualTo(accepted);
        assertThat(loaded.confirmation()).isEqualTo(new Confirmation(confirmed, "dispatcher-7", ConfirmationMethod.MANUAL_OVERRIDE));
        assertThat(loaded.customerInviteSentAt()).isNull();
    }

    @Test
    void onlyOneWriterWinsForTheSameVersion() {
        Schedule inserted = store.insert(draft("s-1", ALEX, 9, T0));
        store.update(inserted.toBuilder().technician(BEA).build(), 1);

        assertThatThrownBy(() -> store.update(inserted.toBuilder().window(window(11)).build(), 1))
                .isInstanceOf(StaleWriteException.class);
        assertThatThrownBy(() -> store.delete("s-1", 1))
                .isInstanceOf(StaleWriteException.class);
        assertThat(store.findById("s-1").orElseThrow().technician()).isEqualTo(BEA);
    }

    @Test
    void missingScheduleIsReportedAsNotFound() {
        Schedule ghost = draft("ghost", ALEX, 9, T0);

        assertThatThrownBy(() -> store.update(ghost, 1)).isInstanceOf(ScheduleNotFoundException.class);
        assertThatThrownBy(() -> store.delete("ghost", 1)).isInstanceOf(ScheduleNotFoundException.class);
    }

    @Test
    void deleteRemovesRow() {
        store.insert(draft("s-1", ALEX, 9, T0));

        store.delete("s-1", 1);

        assertThat(store.findById("s-1")).isEmpty();
    }

    @Test
    void rangeQueryFiltersByTechnicianAndDay() {
        store.insert(draft("s-1", ALEX, 13, T0));
        store.insert(draft("s-2", ALEX, 9, T0));
        store.insert(draft("s-3", BEA, 9, T0));
        store.insert(Schedule.newDraft("s-4", "ticket-s-4", ALEX,
                new TimeWindow(DAY.plusDays(3).atTime(9, 0), DAY.plusDays(3).atTime(10, 0)), T0));

        List<Schedule> alex = store.findInRange(Optional.of("tech-a"), new DateRange(DAY, DAY));
        List<Schedule> everyone = store.findInRange(Optional.empty(), new DateRange(DAY, DAY));

        assertThat(alex).extracting(Schedule::id).containsExactly("s-2", "s-1");
        assertThat(everyone).extracting(Schedule::id).containsExactly("s-2", "s-3", "s-1");
    }

    @Test
    void awaitingResponseIsOldestFirstAndLimited() {
        store.insert(pending("s-new", T0.plusSeconds(300), ConfirmationState.PENDING_CUSTOMER));
        store.insert(pending("s-old", T0, ConfirmationState.PENDING_TECH));
        store.insert(pending("s-mid", T0.plusSeconds(60), ConfirmationState.PENDING_TECH));
        store.insert(draft("s-draft", ALEX, 9, T0.minusSeconds(60)));

        assertThat(store.findAwaitingResponse(Optional.empty(), 10)).extracting(Schedule::id)
                .containsExactly("s-old", "s-mid", "s-new");
        assertThat(store.findAwaitingResponse(Optional.empty(), 2)).extracting(Schedule::id)
                .containsExactly("s-old", "s-mid");
    }

    @Test
    void awaitingResponseCursorContinuesAfterLastSeenRow() {
        store.insert(pending("s-b", T0, ConfirmationState.PENDING_TECH));
        store.insert(pending("s-a", T0, ConfirmationState.PENDING_TECH));
        store.insert(pending("s-c", T0, ConfirmationState.PENDING_CUSTOMER));
        store.insert(pending("s-later", T0.plusSeconds(60), ConfirmationState.PENDING_TECH));

        List<Schedule> first = store.findAwaitingResponse(Optional.empty(), 2);
        List<Schedule> second = store.findAwaitingResponse(Optional.of(AwaitingCursor.after(first.get(1))), 2);
        List<Schedule> third = store.findAwaitingResponse(Optional.of(AwaitingCursor.after(second.get(1))), 2);

        assertThat(first).extracting(Schedule::id).containsExactly("s-a", "s-b");
        assertThat(second).extracting(Schedule::id).containsExactly("s-c", "s-later");
        assertThat(third).isEmpty();
    }

    @Test
    void leaseExcludesOtherOwnersUntilExpiredOrReleased() {
        store.insert(draft("s-1", ALEX, 9, T0));
        Duration ttl = Duration.ofMinutes(2);

        assertThat(store.tryLease("s-1", "worker-1", T0, ttl)).isTrue();
        assertThat(store.tryLease("s-1", "worker-2", T0.plusSeconds(30), ttl)).isFalse();
        assertThat(store.tryLease("s-1", "worker-1", T0.plusSeconds(30), ttl)).isTrue();
        assertThat(store.tryLease("s-1", "worker-2", T0.plusSeconds(200), ttl)).isTrue();

        store.releaseLease("s-1", "worker-1");
        assertThat(store.tryLease("s-1", "worker-1", T0.plusSeconds(210), ttl)).isFalse();

        store.releaseLease("s-1", "worker-2");
        assertThat(store.tryLease("s-1", "worker-1", T0.plusSeconds(210), ttl)).isTrue();
        assertThat(store.tryLease("missing", "worker-1", T0, ttl)).isFalse();
    }

    private static Schedule draft(String id, Technician technician, int hour, Instant createdAt) {
        return Schedule.newDraft(id, "ticket-" + id, technician, window(hour), createdAt);
    }

    private static Schedule pending(String id, Instant createdAt, ConfirmationState state) {
        Schedule.Builder builder = draft(id, ALEX, 9, createdAt).toBuilder()
                .confirmationState(state)
                .externalEventRef("evt-" + id);
        if (state == ConfirmationState.PENDING_CUSTOMER) {
            builder.technicianAcceptedAt(createdAt).customerInviteSentAt(createdAt);
        }
        return builder.build();
    }

    private static TimeWindow window(int hour) {
        return new TimeWindow(DAY.atTime(hour, 0), DAY.atTime(hour + 1, 0));
    }
}
