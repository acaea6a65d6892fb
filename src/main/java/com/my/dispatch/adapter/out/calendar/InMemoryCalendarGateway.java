package com.my.dispatch.adapter.out.calendar;

import com.my.dispatch.domain.exception.GatewayException;
import com.my.dispatch.domain.model.Attendee;
import com.my.dispatch.domain.model.AttendeeResponse;
import com.my.dispatch.domain.model.AttendeeRole;
import com.my.dispatch.domain.model.CalendarEventRequest;
import com.my.dispatch.domain.model.CalendarEventSnapshot;
import com.my.dispatch.domain.model.EventUpdate;
import com.my.dispatch.domain.port.out.CalendarGateway;
import io.quarkus.arc.profile.UnlessBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 구글 자격 증명 없이도 로컬 실행과 테스트에서 승인 흐름 전체를 돌려볼 수 있도록 캘린더를 메모리로 흉내 내기 위함.
 */
@UnlessBuildProfile("prod")
@ApplicationScoped
public class InMemoryCalendarGateway implements CalendarGateway {

    private static final Logger log = Logger.getLogger(InMemoryCalendarGateway.class);

    private final Map<String, StoredEvent> events = new ConcurrentHashMap<>();

    @Override
    public String createEvent(CalendarEventRequest request) {
        String ref = "mem-" + UUID.randomUUID();
        StoredEvent event = new StoredEvent(request.subject(), request.body(), request.tentative(), new ArrayList<>(request.attendees()));
        events.put(ref, event);
        log.debugf("메모리 캘린더 이벤트 생성: %s (%s)", ref, request.subject());
        return ref;
    }

    @Override
    public void updateEvent(String eventRef, EventUpdate update) {
        StoredEvent event = live(eventRef);
        synchronized (event) {
            event.subject = update.subject();
            if (update.description() != null) {
                event.description = update.description();
            }
            event.tentative = update.tentative();
        }
    }

    @Override
    public void addAttendee(String eventRef, Attendee attendee) {
        StoredEvent event = live(eventRef);
        synchronized (event) {
            boolean present = event.attendees.stream()
                    .anyMatch(existing -> existing.email().equalsIgnoreCase(attendee.email()));
            if (!present) {
                event.attendees.add(attendee);
            }
        }
    }

    @Override
    public CalendarEventSnapshot getEvent(String eventRef) {
        StoredEvent event = events.get(eventRef);
        if (event == null || event.cancelled) {
            return CalendarEventSnapshot.missing();
        }
        synchronized (event) {
            return CalendarEventSnapshot.of(new EnumMap<>(event.responses));
        }
    }

    @Override
    public void cancelEvent(String eventRef) {
        StoredEvent event = events.get(eventRef);
        if (event != null) {
            event.cancelled = true;
        }
    }

    /**
     * 참석자가 캘린더에서 응답한 것처럼 기록한다.
     */
    public void respond(String eventRef, AttendeeRole role, AttendeeResponse response) {
        StoredEvent event = live(eventRef);
        synchronized (event) {
            event.responses.put(role, response);
        }
    }

    /**
     * 캘린더 사용자가 이벤트를 직접 지운 상황을 흉내 낸다.
     */
    public void deleteExternally(String eventRef) {
        events.remove(eventRef);
    }

    public Optional<EventView> event(String eventRef) {
        StoredEvent event = events.get(eventRef);
        if (event == null) {
            return Optional.empty();
        }
        synchronized (event) {
            return Optional.of(new EventView(event.subject, event.description, event.tentative, event.cancelled, List.copyOf(event.attendees)));
        }
    }

    private StoredEvent live(String eventRef) {
        StoredEvent event = events.get(eventRef);
        if (event == null || event.cancelled) {
            throw new GatewayException("존재하지 않는 이벤트입니다: " + eventRef);
        }
        return event;
    }

    public record EventView(String subject, String description, boolean tentative, boolean cancelled, List<Attendee> attendees) {
    }

    private static final class StoredEvent {
        private String subject;
        private String description;
        private boolean tentative;
        private volatile boolean cancelled;
        private final List<Attendee> attendees;
        private final Map<AttendeeRole, AttendeeResponse> responses = new EnumMap<>(AttendeeRole.class);

        private StoredEvent(String subject, String description, boolean tentative, List<Attendee> attendees) {
            this.subject = subject;
            this.description = description;
            this.tentative = tentative;
            this.attendees = attendees;
        }
    }
}
