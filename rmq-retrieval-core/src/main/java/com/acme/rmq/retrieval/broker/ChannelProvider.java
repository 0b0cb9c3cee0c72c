package com.acme.rmq.retrieval.broker;

import com.rabbitmq.client.Channel;
import java.io.IOException;

/** Opens the protocol channel a retrieval run works on. The run closes it when done. */
@FunctionalInterface
public interface ChannelProvider {
  Channel openChannel() throws IOException;
}
