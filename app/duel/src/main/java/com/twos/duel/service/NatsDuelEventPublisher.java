/*
 * どこで: Duel 通知
 * 何を: 対戦イベントを JSON にして JetStream へ publish する
 * なぜ: 通知サービスが購読して利用者へ届けるため
 */
package com.twos.duel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twos.duel.config.DuelNatsProperties;
import com.twos.duel.model.DuelEvent;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.impl.Headers;
import java.util.concurrent.CompletableFuture;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JetStream と ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NatsDuelEventPublisher implements DuelEventPublisher {

  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_RECIPIENT = "recipient_user_id";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final DuelNatsProperties properties;
  private final ObjectMapper objectMapper;

  public NatsDuelEventPublisher(
      JetStream jetStream, DuelNatsProperties properties, ObjectMapper objectMapper) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public CompletableFuture<Void> publish(DuelEvent event) {
    if (event == null || event.eventId() == null || event.eventId().isBlank()) {
      throw new IllegalArgumentException("eventId is required");
    }
    final byte[] body = serialize(event);
    final Headers headers = new Headers();
    // 重複排除キーとして event_id を NATS の標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, event.eventId());
    headers.add(HEADER_EVENT_TYPE, event.eventType().name());
    headers.add(HEADER_RECIPIENT, event.recipientUserId());
    headers.add(HEADER_TRACE_ID, event.traceId());
    // PubAck は呼び出しスレッドで待たない
    return jetStream
        .publishAsync(properties.subjectFor(event.eventType().name()), headers, body)
        .thenApply(
            ack -> {
              if (ack == null) {
                throw new IllegalStateException("puback is missing eventId=" + event.eventId());
              }
              return null;
            });
  }

  private byte[] serialize(DuelEvent event) {
    try {
      return objectMapper.writeValueAsBytes(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize duel event", ex);
    }
  }
}
