package com.agri.server;

import com.agri.config.JsonMapper;
import com.agri.hub.EventSink;
import com.agri.hub.HubEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Доставка событий хаба в WebSocket-соединение в виде {"event": ..., "data": ...}.
 * <p>
 * Запись в канал Netty асинхронна; если канал не успевает отправлять (не writable),
 * событие отбрасывается.
 */
public class WebSocketEventSink implements EventSink {

  private final Channel channel;

  public WebSocketEventSink(Channel channel) {
    this.channel = channel;
  }

  @Override
  public void deliver(HubEvent event) throws JsonProcessingException {
    if (!channel.isWritable()) {
      throw new IllegalStateException("channel " + channel.id() + " is not writable");
    }
    channel.writeAndFlush(frame(event.getName(), event.getPayload()));
  }

  @Override
  public boolean isOpen() {
    return channel.isActive();
  }

  static TextWebSocketFrame frame(String event, Object data) throws JsonProcessingException {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("event", event);
    envelope.put("data", data);
    return new TextWebSocketFrame(JsonMapper.get().writeValueAsString(envelope));
  }
}
