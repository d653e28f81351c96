package com.agri.server;

import com.agri.config.JsonMapper;
import com.agri.hub.BroadcastHub;
import com.agri.hub.Subscription;
import com.agri.service.AgricultureService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Канал событий по WebSocket.
 * <p>
 * После рукопожатия соединение подписывается на {@link BroadcastHub} и получает "connected".
 * Клиент может прислать {"event": "request_latest_data"}, в ответ только ему отправляется
 * "latest_sensor_data" со срезом последних показаний (чтение через фасад).
 */
public class WebSocketFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

  public static final String CONNECTED = "connected";
  public static final String REQUEST_LATEST_DATA = "request_latest_data";
  public static final String LATEST_SENSOR_DATA = "latest_sensor_data";

  private static final Logger logger = LoggerFactory.getLogger(WebSocketFrameHandler.class);

  private final BroadcastHub hub;
  private final AgricultureService service;
  private Subscription subscription;

  public WebSocketFrameHandler(BroadcastHub hub, AgricultureService service) {
    this.hub = hub;
    this.service = service;
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
      ctx.writeAndFlush(WebSocketEventSink.frame(CONNECTED,
          Map.of("message", "Connected to Smart Agriculture Server")));
      subscribe(ctx);
      logger.info("🔌 WebSocket-клиент подключён: {}", ctx.channel().remoteAddress());
    } else {
      super.userEventTriggered(ctx, evt);
    }
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) throws JsonProcessingException {
    String event;
    try {
      JsonNode message = JsonMapper.get().readTree(frame.text());
      event = message.path("event").asText("");
    } catch (JsonProcessingException e) {
      ctx.writeAndFlush(WebSocketEventSink.frame("error", Map.of("message", "Invalid JSON message")));
      return;
    }

    if (REQUEST_LATEST_DATA.equals(event)) {
      try {
        ctx.writeAndFlush(WebSocketEventSink.frame(LATEST_SENSOR_DATA, service.latestReadings()));
      } catch (RuntimeException e) {
        logger.error("❌ Не удалось получить срез показаний для {}", ctx.channel().remoteAddress(), e);
        ctx.writeAndFlush(WebSocketEventSink.frame("error", Map.of("message", "Snapshot unavailable")));
      }
    } else {
      ctx.writeAndFlush(WebSocketEventSink.frame("error", Map.of("message", "Unknown event: " + event)));
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    unsubscribe();
    super.channelInactive(ctx);
  }

  private synchronized void subscribe(ChannelHandlerContext ctx) {
    subscription = hub.subscribe(new WebSocketEventSink(ctx.channel()));
    ctx.channel().closeFuture().addListener(f -> unsubscribe());
  }

  private synchronized void unsubscribe() {
    if (subscription != null) {
      hub.unsubscribe(subscription);
      subscription = null;
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.warn("WebSocket-соединение {} закрыто из-за ошибки: {}", ctx.channel().remoteAddress(), cause.toString());
    ctx.close();
  }
}
