package com.agri.server;

import com.agri.config.JsonMapper;
import com.agri.error.NotFoundException;
import com.agri.error.StorageException;
import com.agri.error.ValidationException;
import com.agri.service.AgricultureService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Обработчик REST-запросов.
 * <p>
 * Делегирует обработку фасаду {@link AgricultureService}. Все ответы — JSON вида
 * {"success": true, "data": ...} или {"success": false, "error": "..."}.
 * Выполняется в отдельной группе потоков, потому что обращения к БД блокирующие.
 */
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);

  private static final Pattern HISTORY_PATH = Pattern.compile("^/api/sensors/([^/]+)/history$");

  private final AgricultureService service;
  private final ObjectMapper objectMapper = JsonMapper.get();

  /**
   * Конструктор обработчика.
   *
   * @param service Фасад запросов и команд.
   */
  public HttpServerHandler(AgricultureService service) {
    this.service = service;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    HttpMethod method = request.method();
    QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
    String path = decoder.path();
    logger.debug("📥 {} {}", method, request.uri());

    FullHttpResponse response;
    try {
      response = route(method, path, decoder, request);
    } catch (ValidationException e) {
      response = error(HttpResponseStatus.BAD_REQUEST, e.getMessage());
    } catch (NotFoundException e) {
      response = error(HttpResponseStatus.NOT_FOUND, e.getMessage());
    } catch (MethodNotAllowed e) {
      response = error(HttpResponseStatus.METHOD_NOT_ALLOWED, e.getMessage());
    } catch (JsonProcessingException e) {
      response = error(HttpResponseStatus.BAD_REQUEST, "Invalid JSON body");
    } catch (StorageException e) {
      response = error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Storage unavailable");
    } catch (RuntimeException e) {
      logger.error("❌ Ошибка обработки {} {}", method, path, e);
      response = error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse route(HttpMethod method, String path, QueryStringDecoder decoder,
                                 FullHttpRequest request) throws JsonProcessingException {
    if ("/health".equals(path)) {
      requireGet(method);
      return createJsonResponse(HttpResponseStatus.OK, objectMapper.writeValueAsString(service.health()));
    }
    if ("/api/sensors/latest".equals(path)) {
      requireGet(method);
      return ok(HttpResponseStatus.OK, service.latestReadings());
    }
    Matcher history = HISTORY_PATH.matcher(path);
    if (history.matches()) {
      requireGet(method);
      int hours = intParam(decoder, "hours", AgricultureService.DEFAULT_HISTORY_HOURS);
      return ok(HttpResponseStatus.OK, service.history(history.group(1), hours));
    }
    if ("/api/commands".equals(path)) {
      if (method != HttpMethod.POST) {
        throw new MethodNotAllowed();
      }
      String body = request.content().toString(CharsetUtil.UTF_8);
      if (body.isBlank()) {
        throw new ValidationException("Command body is required");
      }
      CommandRequest data = objectMapper.readValue(body, CommandRequest.class);
      return ok(HttpResponseStatus.CREATED, service.submitCommand(data));
    }
    if ("/api/commands/history".equals(path)) {
      requireGet(method);
      return ok(HttpResponseStatus.OK, service.commandHistory());
    }
    if ("/api/status".equals(path)) {
      requireGet(method);
      return ok(HttpResponseStatus.OK, service.status());
    }
    return error(HttpResponseStatus.NOT_FOUND, "404");
  }

  private static void requireGet(HttpMethod method) {
    if (method != HttpMethod.GET) {
      throw new MethodNotAllowed();
    }
  }

  private static int intParam(QueryStringDecoder decoder, String name, int defaultValue) {
    List<String> values = decoder.parameters().get(name);
    if (values == null || values.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(values.get(0).trim());
    } catch (NumberFormatException e) {
      throw new ValidationException(name + " must be an integer");
    }
  }

  private FullHttpResponse ok(HttpResponseStatus status, Object data) throws JsonProcessingException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("data", data);
    return createJsonResponse(status, objectMapper.writeValueAsString(body));
  }

  private FullHttpResponse error(HttpResponseStatus status, String message) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("success", false);
    body.put("error", message);
    return createJsonResponse(status, body.toString());
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, String body) {
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    res.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
    return res;
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("❌ Ошибка канала {}", ctx.channel(), cause);
    ctx.close();
  }

  /** Путь известен, метод — нет. */
  private static final class MethodNotAllowed extends RuntimeException {
    MethodNotAllowed() {
      super("Method not allowed", null, false, false);
    }
  }
}
