package com.agri.hub;

/**
 * Канал доставки одного подписчика (например, WebSocket-соединение).
 */
public interface EventSink {

  /**
   * Передаёт событие подписчику. Вызывается из потока доставки хаба, не из потока издателя.
   *
   * @throws Exception ошибка доставки; хаб логирует её и отбрасывает событие.
   */
  void deliver(HubEvent event) throws Exception;

  /**
   * @return false, если подписчик отключился; хаб тогда удаляет подписку.
   */
  boolean isOpen();
}
