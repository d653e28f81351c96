package com.agri.error;

/**
 * Ошибка хранилища данных.
 * <p>
 * Вызывающий код не должен рассчитывать на автоматический повтор: HTTP-слой отвечает 500,
 * фоновые задачи логируют ошибку и пропускают текущий такт.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
