package com.agri.db;

import com.agri.model.Command;
import com.agri.model.CommandStatus;
import com.agri.model.Reading;
import com.agri.model.Rover;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Единственная точка доступа к хранилищу: показания, команды и реестр роверов.
 * <p>
 * Каждый вызов выполняется в отдельной транзакции; частичные записи читателям не видны.
 * Ошибки хранилища выбрасываются как {@link com.agri.error.StorageException}, автоматических
 * повторов нет.
 */
public interface PersistenceGateway {

  /**
   * Сохраняет показание.
   *
   * @return Присвоенный идентификатор.
   */
  long insertReading(Reading reading);

  /**
   * Последнее показание каждого датчика, упорядочено по probe_id.
   */
  Map<String, Reading> queryLatestPerProbe();

  /**
   * Показания датчика за последние {@code since}, по возрастанию времени.
   */
  List<Reading> queryHistory(String probeId, Duration since);

  /**
   * Сохраняет новую команду.
   *
   * @return Внутренний идентификатор строки.
   */
  long insertCommand(Command command);

  /**
   * Переводит команду в {@code status}, только если она находится в предшествующем состоянии
   * ({@link CommandStatus#predecessor()}). Проверка и запись атомарны, поэтому переходы одной команды
   * упорядочены, а захват pending → in_progress достаётся ровно одному вызывающему.
   *
   * @param result Текст результата; обязателен для терминального статуса.
   * @param completedAt Время завершения; обязательно для терминального статуса.
   * @return true, если строка изменена; false, если команда уже терминальная или уже захвачена.
   * @throws com.agri.error.NotFoundException если команды с таким id нет.
   */
  boolean updateCommandStatus(String commandId, CommandStatus status, String result, Instant completedAt);

  Optional<Command> findCommand(String commandId);

  /**
   * Последние {@code limit} команд по убыванию created_at.
   */
  List<Command> queryCommandHistory(int limit);

  /**
   * Команды в данном статусе по возрастанию created_at.
   */
  List<Command> listCommandsByStatus(CommandStatus status);

  Map<CommandStatus, Long> countCommandsByStatus();

  List<Rover> listRovers();
}
