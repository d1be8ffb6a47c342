package com.takeaway.storefront.notification;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.takeaway.storefront.config.SecretResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoEventLogSinkTest {

    @Mock
    private SecretResolver secretResolver;

    private MongoEventLogSink sink;

    @AfterEach
    void tearDown() {
        if (sink != null) {
            sink.close();
        }
    }

    @Test
    void clientSettingsUseTheNotificationTimeout() {
        sink = new MongoEventLogSink(secretResolver, "storefront", 10);

        MongoClientSettings settings = sink.settings(new ConnectionString("mongodb://localhost:27017/events"));

        assertThat(settings.getClusterSettings().getServerSelectionTimeout(TimeUnit.SECONDS)).isEqualTo(10);
        assertThat(settings.getSocketSettings().getConnectTimeout(TimeUnit.SECONDS)).isEqualTo(10);
        assertThat(settings.getSocketSettings().getReadTimeout(TimeUnit.SECONDS)).isEqualTo(10);
    }

    @Test
    void missingSecretDisablesTheSink() {
        when(secretResolver.resolve(SecretResolver.EVENT_LOG_MONGO_URI)).thenReturn(Optional.empty());
        sink = new MongoEventLogSink(secretResolver, "storefront", 10);

        assertThat(sink.isEnabled()).isFalse();
    }

    @Test
    void unreachableServerFailsWithinTheTimeout() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        when(secretResolver.resolve(SecretResolver.EVENT_LOG_MONGO_URI))
                .thenReturn(Optional.of("mongodb://127.0.0.1:" + port + "/events"));
        sink = new MongoEventLogSink(secretResolver, "storefront", 1);

        Instant start = Instant.now();
        EventLogWriteException error = catchThrowableOfType(
                () -> sink.append(OrderEventLogger.COLLECTION, Map.of("order_id", 1L)),
                EventLogWriteException.class);

        assertThat(error).isNotNull();
        assertThat(error.isTransient()).isTrue();
        assertThat(Duration.between(start, Instant.now())).isLessThan(Duration.ofSeconds(5));
    }
}
