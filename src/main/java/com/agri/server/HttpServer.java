package com.agri.server;

import com.agri.config.Config;
import com.agri.config.SimulationSettings;
import com.agri.db.DatabaseConnection;
import com.agri.db.JdbcPersistenceGateway;
import com.agri.db.PersistenceGateway;
import com.agri.hub.BroadcastHub;
import com.agri.service.AgricultureService;
import com.agri.service.AgricultureServiceImpl;
import com.agri.simulation.RoverCommandEngine;
import com.agri.simulation.SensorSimulator;
import com.zaxxer.hikari.HikariDataSource;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.security.SecureRandom;
import java.time.Clock;

/**
 * Главный класс приложения. Запускает HTTP-сервер на Netty: REST API и канал событий /ws.
 */
public class HttpServer {

  public static final String WEBSOCKET_PATH = "/ws";

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private final int port;
  private final AgricultureService service;
  private final BroadcastHub hub;

  private EventLoopGroup bossGroup;
  private EventLoopGroup workerGroup;
  private EventExecutorGroup blockingGroup;
  private Channel serverChannel;

  /**
   * Конструктор HTTP-сервера.
   *
   * @param port Порт, на котором будет работать сервер (0 означает любой свободный).
   * @param service Фасад запросов и команд.
   * @param hub Хаб, к которому подписываются WebSocket-клиенты.
   */
  public HttpServer(int port, AgricultureService service, BroadcastHub hub) {
    this.port = port;
    this.service = service;
    this.hub = hub;
  }

  /**
   * Привязывает сервер к порту и возвращает управление.
   *
   * @throws InterruptedException если поток прерван во время привязки.
   */
  public synchronized void start() throws InterruptedException {
    if (serverChannel != null) {
      return;
    }
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup();
    // обработчики ходят в БД, поэтому не занимают потоки event loop
    blockingGroup = new DefaultEventExecutorGroup(Config.getInt("http.worker.threads", 16));

    ServerBootstrap b = new ServerBootstrap();
    b.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          public void initChannel(SocketChannel ch) {
            ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(65536))
                .addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH))
                .addLast(blockingGroup, new WebSocketFrameHandler(hub, service))
                .addLast(blockingGroup, new HttpServerHandler(service));
          }
        })
        .option(ChannelOption.SO_BACKLOG, 128)
        .childOption(ChannelOption.SO_KEEPALIVE, true);

    serverChannel = b.bind(port).sync().channel();
    logger.info("🚀 Сервер запущен на http://localhost:{} (события: ws://localhost:{}{})",
        getPort(), getPort(), WEBSOCKET_PATH);
  }

  /** Фактический порт после {@link #start()}. */
  public int getPort() {
    return ((InetSocketAddress) serverChannel.localAddress()).getPort();
  }

  /**
   * Блокирует поток до закрытия серверного канала.
   */
  public void awaitTermination() throws InterruptedException {
    serverChannel.closeFuture().sync();
  }

  public synchronized void stop() {
    if (serverChannel == null) {
      return;
    }
    serverChannel.close().syncUninterruptibly();
    serverChannel = null;
    workerGroup.shutdownGracefully();
    bossGroup.shutdownGracefully();
    blockingGroup.shutdownGracefully();
    logger.info("Сервер остановлен");
  }

  /**
   * Точка входа в приложение.
   * Создаёт пул соединений, инициализирует БД, запускает симуляцию и сервер на порту server.port.
   *
   * @param args Аргументы командной строки (не используются).
   * @throws Exception если произошла ошибка при запуске.
   */
  public static void main(String[] args) throws Exception {
    HikariDataSource dataSource = DatabaseConnection.createDataSource();
    DatabaseConnection.initializeDatabase(dataSource);

    Clock clock = Clock.systemUTC();
    SimulationSettings settings = SimulationSettings.fromConfig();
    PersistenceGateway gateway = new JdbcPersistenceGateway(dataSource, clock);
    BroadcastHub hub = new BroadcastHub(settings.getSubscriberQueueCapacity());
    SecureRandom random = new SecureRandom();

    SensorSimulator simulator = new SensorSimulator(gateway, hub, settings, clock, random);
    RoverCommandEngine commandEngine = new RoverCommandEngine(gateway, hub, settings, clock, random);
    AgricultureService service = new AgricultureServiceImpl(gateway, commandEngine, settings.getProbeIds(), clock);
    HttpServer server = new HttpServer(Config.getInt("server.port", 8081), service, hub);

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      logger.info("Завершение работы...");
      server.stop();
      simulator.stop();
      commandEngine.stop();
      hub.close();
      dataSource.close();
    }, "shutdown"));

    simulator.start();
    commandEngine.start();
    server.start();
    server.awaitTermination();
  }
}
