package com.acme.rmq.retrieval.broker;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.rmq.retrieval.core.QueueNotFoundException;
import com.acme.rmq.retrieval.core.TransientException;
import com.acme.rmq.retrieval.model.QueueSnapshot;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueueValidatorTest {

  @Mock private Channel channel;

  private final QueueValidator validator = new QueueValidator();

  @Test
  void testValidate_existingQueueReturnsSnapshot() throws Exception {
    AMQP.Queue.DeclareOk declareOk = mock(AMQP.Queue.DeclareOk.class);
    when(declareOk.getMessageCount()).thenReturn(42);
    when(declareOk.getConsumerCount()).thenReturn(2);
    when(channel.queueDeclarePassive("orders")).thenReturn(declareOk);

    QueueSnapshot snapshot = validator.validate(channel, "orders");

    assertThat(snapshot.exists()).isTrue();
    assertThat(snapshot.queue()).isEqualTo("orders");
    assertThat(snapshot.messageCount()).isEqualTo(42);
    assertThat(snapshot.consumerCount()).isEqualTo(2);
    assertThat(snapshot.isEmpty()).isFalse();
  }

  @Test
  void testValidate_missingQueueRaisesQueueNotFound() throws Exception {
    when(channel.queueDeclarePassive("missing"))
        .thenThrow(channelClose(AMQP.NOT_FOUND, "NOT_FOUND - no queue 'missing'"));

    assertThatThrownBy(() -> validator.validate(channel, "missing"))
        .isInstanceOf(QueueNotFoundException.class)
        .satisfies(e -> {
          QueueNotFoundException notFound = (QueueNotFoundException) e;
          assertThat(notFound.getQueue()).isEqualTo("missing");
          assertThat(notFound.getErrorInfo().code()).isEqualTo("QUEUE_NOT_FOUND");
          assertThat(notFound.getErrorInfo().category()).isEqualTo("routing");
          assertThat(notFound.getErrorInfo().error()).isEqualTo("Queue 'missing' not found");
        });
  }

  @Test
  void testValidate_otherChannelErrorIsTransient() throws Exception {
    when(channel.queueDeclarePassive("orders"))
        .thenThrow(channelClose(AMQP.ACCESS_REFUSED, "ACCESS_REFUSED"));

    assertThatThrownBy(() -> validator.validate(channel, "orders"))
        .isInstanceOf(TransientException.class)
        .hasMessageContaining("orders");
  }

  @Test
  void testValidate_plainIoErrorIsTransient() throws Exception {
    when(channel.queueDeclarePassive("orders")).thenThrow(new IOException("connection reset"));

    assertThatThrownBy(() -> validator.validate(channel, "orders"))
        .isInstanceOf(TransientException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void testValidate_closedChannelIsTransient() throws Exception {
    ShutdownSignalException shutdown = new ShutdownSignalException(false, true, null, channel);
    when(channel.queueDeclarePassive("orders")).thenThrow(new AlreadyClosedException(shutdown));

    assertThatThrownBy(() -> validator.validate(channel, "orders"))
        .isInstanceOf(TransientException.class);
  }

  private IOException channelClose(int replyCode, String replyText) {
    AMQP.Channel.Close close = new AMQP.Channel.Close.Builder()
        .replyCode(replyCode)
        .replyText(replyText)
        .build();
    return new IOException(new ShutdownSignalException(false, false, close, channel));
  }
}
