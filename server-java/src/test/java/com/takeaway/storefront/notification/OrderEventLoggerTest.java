package com.takeaway.storefront.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrderEventLoggerTest {

    @Mock
    private EventLogSink sink;

    private final List<Duration> sleeps = new ArrayList<>();
    private OrderEventLogger eventLogger;

    @BeforeEach
    void setUp() {
        eventLogger = new OrderEventLogger(sink, new BoundedRetry(3, Duration.ofSeconds(1), sleeps::add));
        when(sink.isEnabled()).thenReturn(true);
    }

    @Test
    void storesPaymentAuthorisedDocument() {
        when(sink.append(eq(OrderEventLogger.COLLECTION), anyMap())).thenReturn("abc123");

        Optional<String> id = eventLogger.logEvent(12L, "jane@example.com", OrderEventLogger.PAYMENT_AUTHORISED,
                Map.of("delivery", Map.of("postcode", "SW1A 1AA")));

        assertThat(id).contains("abc123");
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> document = ArgumentCaptor.forClass(Map.class);
        verify(sink).append(eq("order_events"), document.capture());
        assertThat(document.getValue())
                .containsEntry("order_id", "12")
                .containsEntry("user_email", "jane@example.com")
                .containsEntry("event", "PAYMENT_AUTHORISED")
                .containsKeys("payload", "created_at_iso");
    }

    @Test
    void retriesTransientFailuresThenGivesUpQuietly() {
        when(sink.append(anyString(), anyMap()))
                .thenThrow(new EventLogWriteException("socket closed", null, true));

        Optional<String> id = eventLogger.logEvent(12L, "jane@example.com", OrderEventLogger.PAYMENT_AUTHORISED, Map.of());

        assertThat(id).isEmpty();
        verify(sink, times(3)).append(anyString(), anyMap());
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void recoversWhenALaterAttemptSucceeds() {
        when(sink.append(anyString(), anyMap()))
                .thenThrow(new EventLogWriteException("timeout", null, true))
                .thenReturn("def456");

        assertThat(eventLogger.logEvent(13L, "a@b.com", OrderEventLogger.PAYMENT_AUTHORISED, Map.of()))
                .contains("def456");
        verify(sink, times(2)).append(anyString(), anyMap());
    }

    @Test
    void permanentFailureIsNotRetried() {
        when(sink.append(anyString(), anyMap()))
                .thenThrow(new EventLogWriteException("unauthorised", null, false));

        assertThat(eventLogger.logEvent(14L, "a@b.com", OrderEventLogger.PAYMENT_AUTHORISED, Map.of())).isEmpty();
        verify(sink, times(1)).append(anyString(), anyMap());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void disabledSinkIsSkipped() {
        when(sink.isEnabled()).thenReturn(false);

        assertThat(eventLogger.logEvent(15L, "a@b.com", OrderEventLogger.PAYMENT_AUTHORISED, Map.of())).isEmpty();
        verify(sink, never()).append(anyString(), anyMap());
    }
}
