package com.agri.service;

import com.agri.model.Command;
import com.agri.model.Reading;
import com.agri.model.SystemStatus;
import com.agri.server.CommandRequest;

import java.util.List;
import java.util.Map;

/**
 * Фасад запросов и команд для HTTP- и WebSocket-слоя.
 * <p>
 * Только делегирует хранилищу и движку команд; собственного изменяемого состояния нет,
 * с планировщиками не взаимодействует.
 */
public interface AgricultureService {

  int DEFAULT_HISTORY_HOURS = 24;
  int DEFAULT_COMMAND_HISTORY_LIMIT = 50;

  /**
   * Последнее показание каждого датчика.
   */
  Map<String, Reading> latestReadings();

  /**
   * История показаний датчика за последние {@code hours} часов по возрастанию времени.
   *
   * @throws com.agri.error.NotFoundException если датчик не сконфигурирован.
   * @throws com.agri.error.ValidationException если hours не положительно.
   */
  List<Reading> history(String probeId, int hours);

  /**
   * Принимает команду роверу.
   *
   * @return Созданная команда в статусе pending.
   * @throws com.agri.error.ValidationException если запрос некорректен.
   */
  Command submitCommand(CommandRequest request);

  List<Command> commandHistory();

  List<Command> commandHistory(int limit);

  SystemStatus status();

  /**
   * Признак жизни процесса. Хранилище не опрашивает.
   */
  Map<String, Object> health();
}
