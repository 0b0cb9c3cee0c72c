package com.acme.rmq.retrieval.broker;

import com.acme.rmq.retrieval.core.QueueNotFoundException;
import com.acme.rmq.retrieval.core.TransientException;
import com.acme.rmq.retrieval.model.QueueSnapshot;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that a queue exists with a passive declare, which never creates or modifies the queue.
 * A missing queue is terminal for the run; there are no retries.
 */
public class QueueValidator {
  private static final Logger log = LoggerFactory.getLogger(QueueValidator.class);

  /**
   * @return snapshot of the queue at the time of the check
   * @throws QueueNotFoundException if the broker reports the queue missing (the broker also closes
   *     the channel in this case)
   * @throws TransientException for any other broker failure
   */
  public QueueSnapshot validate(Channel channel, String queue) {
    try {
      AMQP.Queue.DeclareOk ok = channel.queueDeclarePassive(queue);
      log.debug(
          "Queue '{}' exists with {} messages and {} consumers",
          queue,
          ok.getMessageCount(),
          ok.getConsumerCount());
      return QueueSnapshot.of(queue, ok.getMessageCount(), ok.getConsumerCount());
    } catch (IOException e) {
      if (isNotFound(e.getCause())) {
        log.error("Queue '{}' not found: {}", queue, replyText(e.getCause()));
        throw new QueueNotFoundException(queue, e);
      }
      throw new TransientException("Failed to check queue '" + queue + "'", e);
    } catch (AlreadyClosedException e) {
      throw new TransientException("Channel closed while checking queue '" + queue + "'", e);
    }
  }

  private static boolean isNotFound(Throwable cause) {
    return cause instanceof ShutdownSignalException sse
        && sse.getReason() instanceof AMQP.Channel.Close close
        && close.getReplyCode() == AMQP.NOT_FOUND;
  }

  private static String replyText(Throwable cause) {
    if (cause instanceof ShutdownSignalException sse
        && sse.getReason() instanceof AMQP.Channel.Close close) {
      return close.getReplyCode() + " " + close.getReplyText();
    }
    return String.valueOf(cause);
  }
}
