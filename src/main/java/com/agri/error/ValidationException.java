package com.agri.error;

/**
 * Некорректный ввод клиента (неизвестный тип команды, пустая зона, неверные параметры).
 * Отображается в HTTP 400 и никогда не повторяется автоматически.
 */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
