/*
 * どこで: Duel NATS 初期化
 * 何を: 対戦通知用の JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.twos.duel.nats;

import com.twos.duel.config.DuelNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class DuelJetStreamBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(DuelJetStreamBootstrap.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final Connection connection;
    private final DuelNatsProperties properties;

    @PostConstruct
    public void start() {
        if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
            throw new IllegalStateException("duel.nats.duplicate-window must be positive");
        }
        // 種別ごとの subject (duel.events.<type>) をすべて同じ stream に収める
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subjectWildcard())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        try {
            upsertStream(connection.jetStreamManagement(), streamConfiguration);
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to ensure JetStream stream", ex);
        }
        logger.info("duel stream ensured stream={} subjects={} duplicateWindow={}",
                properties.stream(),
                properties.subjectWildcard(),
                properties.duplicateWindow());
    }

    private void upsertStream(JetStreamManagement jetStreamManagement,
            StreamConfiguration streamConfiguration) throws IOException, JetStreamApiException {
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
                    && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
    }
}
