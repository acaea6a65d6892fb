package com.my.dispatch.adapter.out.google;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.DateTime;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.CalendarScopes;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import com.my.dispatch.config.AppConfig;
import com.my.dispatch.domain.exception.GatewayException;
import com.my.dispatch.domain.model.Attendee;
import com.my.dispatch.domain.model.AttendeeResponse;
import com.my.dispatch.domain.model.AttendeeRole;
import com.my.dispatch.domain.model.CalendarEventRequest;
import com.my.dispatch.domain.model.CalendarEventSnapshot;
import com.my.dispatch.domain.model.EventUpdate;
import com.my.dispatch.domain.port.out.CalendarGateway;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 왜: 구글 Calendar 연동을 게이트웨이 포트 계약에 맞게 구현하여 시간대/응답 매핑 정책을 한 곳에 두기 위함.
 * <p>
 * 참석자 역할은 이벤트의 private extended property 에 {@code role.technician=<email>} 형태로 남겨
 * 조회 시 어느 참석자가 기사이고 고객인지 다시 알 수 있게 한다.
 */
@IfBuildProfile("prod")
@ApplicationScoped
public class GoogleCalendarAdapter implements CalendarGateway {

    private static final Logger log = Logger.getLogger(GoogleCalendarAdapter.class);

    private static final DateTimeFormatter RFC3339 = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final List<String> SCOPES = List.of(CalendarScopes.CALENDAR_EVENTS);
    private static final String TOKEN_USER_ID = "default";
    private static final String APP_NAME = "field-dispatch";
    private static final String ROLE_PROPERTY_PREFIX = "role.";
    private static final String SEND_UPDATES_ALL = "all";

    private final Path credentialDir;
    private final Path clientSecretPath;
    private final String calendarId;
    private final ZoneId zoneId;
    private final int timeoutMillis;
    private final GsonFactory jsonFactory;
    private final NetHttpTransport httpTransport;

    @Inject
    public GoogleCalendarAdapter(AppConfig appConfig) {
        try {
            this.credentialDir = Path.of(appConfig.calendar().credentialPath());
            Files.createDirectories(credentialDir);
            this.clientSecretPath = credentialDir.resolve("client_secret.json");
            this.calendarId = appConfig.calendar().calendarId();
            this.zoneId = ZoneId.of(appConfig.schedule().zone());
            this.timeoutMillis = appConfig.calendar().timeoutSeconds() * 1000;
            this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
            this.jsonFactory = GsonFactory.getDefaultInstance();
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("구글 캘린더 클라이언트 초기화 실패", e);
        }
    }

    @Override
    public String createEvent(CalendarEventRequest request) {
        Event event = new Event()
                .setSummary(request.subject())
                .setDescription(request.body())
                .setLocation(request.location())
                .setStart(toEventDateTime(request.window().start()))
                .setEnd(toEventDateTime(request.window().end()))
                .setTransparency(transparency(request.tentative()));
        List<EventAttendee> attendees = new ArrayList<>();
        Map<String, String> roles = new HashMap<>();
        for (Attendee attendee : request.attendees()) {
            attendees.add(toEventAttendee(attendee));
            roles.put(roleKey(attendee.role()), attendee.email());
        }
        event.setAttendees(attendees);
        event.setExtendedProperties(new Event.ExtendedProperties().setPrivate(roles));
        try {
            Event created = calendar().events().insert(calendarId, event)
                    .setSendUpdates(SEND_UPDATES_ALL)
                    .execute();
            log.infof("구글 캘린더 이벤트 생성: %s", created.getId());
            return created.getId();
        } catch (IOException e) {
            throw new GatewayException("캘린더 이벤트 생성 실패: " + e.getMessage(), e);
        }
    }

    @Override
    @Retry(maxRetries = 3, delay = 1000, retryOn = GatewayException.class)
    public void updateEvent(String eventRef, EventUpdate update) {
        Event patch = new Event()
                .setSummary(update.subject())
                .setTransparency(transparency(update.tentative()));
        if (update.description() != null) {
            patch.setDescription(update.description());
        }
        try {
            calendar().events().patch(calendarId, eventRef, patch).execute();
        } catch (IOException e) {
            throw new GatewayException("캘린더 이벤트 수정 실패: " + eventRef, e);
        }
    }

    @Override
    @Retry(maxRetries = 3, delay = 1000, retryOn = GatewayException.class)
    public void addAttendee(String eventRef, Attendee attendee) {
        try {
            Calendar calendar = calendar();
            Event existing = calendar.events().get(calendarId, eventRef).execute();
            List<EventAttendee> attendees = existing.getAttendees() == null
                    ? new ArrayList<>()
                    : new ArrayList<>(existing.getAttendees());
            boolean present = attendees.stream()
                    .anyMatch(current -> attendee.email().equalsIgnoreCase(current.getEmail()));
            if (present) {
                return;
            }
            attendees.add(toEventAttendee(attendee));
            Map<String, String> roles = new HashMap<>(privateProperties(existing));
            roles.put(roleKey(attendee.role()), attendee.email());
            Event patch = new Event()
                    .setAttendees(attendees)
                    .setExtendedProperties(new Event.ExtendedProperties().setPrivate(roles));
            calendar.events().patch(calendarId, eventRef, patch)
                    .setSendUpdates(SEND_UPDATES_ALL)
                    .execute();
        } catch (IOException e) {
            throw new GatewayException("캘린더 참석자 추가 실패: " + eventRef, e);
        }
    }

    @Override
    @Retry(maxRetries = 3, delay = 1000, retryOn = GatewayException.class)
    public CalendarEventSnapshot getEvent(String eventRef) {
        try {
            return toSnapshot(calendar().events().get(calendarId, eventRef).execute());
        } catch (GoogleJsonResponseException e) {
            if (isGone(e)) {
                return CalendarEventSnapshot.missing();
            }
            throw new GatewayException("캘린더 이벤트 조회 실패: " + eventRef, e);
        } catch (IOException e) {
            throw new GatewayException("캘린더 이벤트 조회 실패: " + eventRef, e);
        }
    }

    @Override
    @Retry(maxRetries = 3, delay = 1000, retryOn = GatewayException.class)
    public void cancelEvent(String eventRef) {
        try {
            calendar().events().delete(calendarId, eventRef)
                    .setSendUpdates(SEND_UPDATES_ALL)
                    .execute();
        } catch (GoogleJsonResponseException e) {
            if (isGone(e)) {
                log.debugf("이미 삭제된 이벤트입니다: %s", eventRef);
                return;
            }
            throw new GatewayException("캘린더 이벤트 취소 실패: " + eventRef, e);
        } catch (IOException e) {
            throw new GatewayException("캘린더 이벤트 취소 실패: " + eventRef, e);
        }
    }

    static CalendarEventSnapshot toSnapshot(Event event) {
        if (event == null || "cancelled".equals(event.getStatus())) {
            return CalendarEventSnapshot.missing();
        }
        Map<String, String> roles = privateProperties(event);
        List<EventAttendee> attendees = event.getAttendees() == null ? List.of() : event.getAttendees();
        Map<AttendeeRole, AttendeeResponse> responses = new EnumMap<>(AttendeeRole.class);
        for (AttendeeRole role : AttendeeRole.values()) {
            String email = roles.get(roleKey(role));
            if (email == null) {
                continue;
            }
            attendees.stream()
                    .filter(attendee -> email.equalsIgnoreCase(attendee.getEmail()))
                    .findFirst()
                    .ifPresent(attendee -> responses.put(role, toResponse(attendee)));
        }
        return CalendarEventSnapshot.of(responses);
    }

    static AttendeeResponse toResponse(EventAttendee attendee) {
        if (Boolean.TRUE.equals(attendee.getSelf()) || Boolean.TRUE.equals(attendee.getOrganizer())) {
            return AttendeeResponse.ACCEPTED;
        }
        String status = attendee.getResponseStatus();
        if (status == null) {
            return AttendeeResponse.NONE;
        }
        return switch (status) {
            case "accepted" -> AttendeeResponse.ACCEPTED;
            case "declined" -> AttendeeResponse.DECLINED;
            case "tentative" -> AttendeeResponse.TENTATIVE;
            default -> AttendeeResponse.NONE;
        };
    }

    private static Map<String, String> privateProperties(Event event) {
        if (event.getExtendedProperties() == null || event.getExtendedProperties().getPrivate() == null) {
            return Map.of();
        }
        return event.getExtendedProperties().getPrivate();
    }

    private static String roleKey(AttendeeRole role) {
        return ROLE_PROPERTY_PREFIX + role.name().toLowerCase(Locale.ROOT);
    }

    private static boolean isGone(GoogleJsonResponseException e) {
        return e.getStatusCode() == 404 || e.getStatusCode() == 410;
    }

    private static String transparency(boolean tentative) {
        return tentative ? "transparent" : "opaque";
    }

    private EventAttendee toEventAttendee(Attendee attendee) {
        return new EventAttendee()
                .setEmail(attendee.email())
                .setDisplayName(attendee.displayName());
    }

    private EventDateTime toEventDateTime(LocalDateTime dateTime) {
        return new EventDateTime()
                .setDateTime(DateTime.parseRfc3339(dateTime.atZone(zoneId).format(RFC3339)))
                .setTimeZone(zoneId.getId());
    }

    private Calendar calendar() {
        Credential credential = loadCredentialOrThrow();
        HttpRequestInitializer initializer = request -> {
            credential.initialize(request);
            request.setConnectTimeout(timeoutMillis);
            request.setReadTimeout(timeoutMillis);
        };
        return new Calendar.Builder(httpTransport, jsonFactory, initializer)
                .setApplicationName(APP_NAME)
                .build();
    }

    private Credential loadCredentialOrThrow() {
        GoogleAuthorizationCodeFlow flow = buildFlow();
        try {
            Credential credential = flow.loadCredential(TOKEN_USER_ID);
            if (credential == null) {
                throw new IllegalStateException("구글 자격 증명이 없습니다. 토큰을 " + credentialDir + " 에 준비하세요.");
            }
            return credential;
        } catch (IOException e) {
            throw new GatewayException("구글 자격 증명 로드 실패", e);
        }
    }

    private GoogleAuthorizationCodeFlow buildFlow() {
        if (!Files.exists(clientSecretPath)) {
            throw new IllegalStateException("client_secret.json 파일이 필요합니다: " + clientSecretPath);
        }
        try (Reader reader = Files.newBufferedReader(clientSecretPath)) {
            GoogleClientSecrets clientSecrets = GoogleClientSecrets.load(jsonFactory, reader);
            return new GoogleAuthorizationCodeFlow.Builder(httpTransport, jsonFactory, clientSecrets, SCOPES)
                    .setDataStoreFactory(new FileDataStoreFactory(credentialDir.toFile()))
                    .setAccessType("offline")
                    .build();
        } catch (IOException e) {
            throw new IllegalStateException("구글 OAuth 플로우 초기화 실패", e);
        }
    }
}
