package com.agri.error;

/**
 * Запрошенный объект (датчик, команда) не существует. Отображается в HTTP 404.
 */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }
}
