package com.agri.db;

import com.agri.error.StorageException;
import org.slf4j.Logger;

import java.sql.SQLException;

/**
 * Переводит {@link SQLException} в {@link StorageException} и логирует исходную ошибку.
 */
final class ExceptionTranslator {

  private ExceptionTranslator() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * @param e Исходная ошибка драйвера.
   * @param operation Описание операции ("insert reading").
   * @param logger Логгер вызывающего DAO.
   * @return Исключение для выброса вызывающим кодом.
   */
  static StorageException translate(SQLException e, String operation, Logger logger) {
    logger.error("❌ Ошибка БД при операции '{}' (SQLState={}, code={})",
        operation, e.getSQLState(), e.getErrorCode(), e);
    return new StorageException(
        String.format("Database error during %s: %s", operation, e.getMessage()), e);
  }
}
