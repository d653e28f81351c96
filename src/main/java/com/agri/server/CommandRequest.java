package com.agri.server;

import java.util.Map;

/**
 * Тело запроса POST /api/commands.
 * Используется для десериализации JSON: {"command_type": ..., "zone": ..., "parameters": {...}}.
 */
public class CommandRequest {

  private String commandType;
  private String zone;
  private Map<String, Object> parameters;

  /**
   * Конструктор по умолчанию. Обязателен для работы с Jackson.
   */
  public CommandRequest() {}

  public CommandRequest(String commandType, String zone, Map<String, Object> parameters) {
    this.commandType = commandType;
    this.zone = zone;
    this.parameters = parameters;
  }

  /**
   * @return Тип команды ("irrigate", "fertilize", ...).
   */
  public String getCommandType() {
    return commandType;
  }

  public void setCommandType(String commandType) {
    this.commandType = commandType;
  }

  /**
   * @return Зона поля, например "Zone A".
   */
  public String getZone() {
    return zone;
  }

  public void setZone(String zone) {
    this.zone = zone;
  }

  /**
   * @return Произвольные параметры команды; может быть null.
   */
  public Map<String, Object> getParameters() {
    return parameters;
  }

  public void setParameters(Map<String, Object> parameters) {
    this.parameters = parameters;
  }
}
