package com.agri.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Утилитарный класс для загрузки конфигурации из application.properties.
 * <p>
 * Все параметры читаются из classpath-файла "application.properties".
 * Системное свойство JVM с тем же ключом имеет приоритет над файлом.
 */
public final class Config {

  private static final Properties PROPS = new Properties();

  static {
    try (InputStream input = Config.class.getClassLoader()
        .getResourceAsStream("application.properties")) {
      if (input == null) {
        throw new IllegalStateException("Файл application.properties не найден в classpath.");
      }
      PROPS.load(input);
    } catch (IOException e) {
      throw new IllegalStateException("Не удалось загрузить application.properties", e);
    }
  }

  /**
   * Возвращает значение обязательного параметра по ключу.
   * <p>
   * Если параметр отсутствует или пуст — бросает исключение.
   *
   * @param key Ключ параметра (например, "db.url").
   * @return Непустое строковое значение.
   * @throws IllegalStateException если параметр не задан или пуст.
   */
  public static String getRequiredProperty(String key) {
    String value = lookup(key);
    if (value == null || value.isEmpty()) {
      throw new IllegalStateException("Обязательный параметр '" + key + "' не задан ни в системных свойствах, ни в application.properties");
    }
    return value;
  }

  /**
   * Возвращает значение параметра или значение по умолчанию.
   */
  public static String getProperty(String key, String defaultValue) {
    String value = lookup(key);
    return value == null || value.isEmpty() ? defaultValue : value;
  }

  public static int getInt(String key, int defaultValue) {
    String value = lookup(key);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Параметр '" + key + "' должен быть целым числом: " + value, e);
    }
  }

  public static long getLong(String key, long defaultValue) {
    String value = lookup(key);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Параметр '" + key + "' должен быть целым числом: " + value, e);
    }
  }

  public static double getDouble(String key, double defaultValue) {
    String value = lookup(key);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Параметр '" + key + "' должен быть числом: " + value, e);
    }
  }

  /**
   * Возвращает список значений, разделённых запятыми.
   * Пустые элементы отбрасываются.
   */
  public static List<String> getList(String key, List<String> defaultValue) {
    String value = lookup(key);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toList());
  }

  private static String lookup(String key) {
    // Сначала пробуем системное свойство
    String sysValue = System.getProperty(key);
    if (sysValue != null && !sysValue.trim().isEmpty()) {
      return sysValue.trim();
    }
    // Иначе — из application.properties
    String propValue = PROPS.getProperty(key);
    return propValue == null ? null : propValue.trim();
  }

  // Запрещаем создание экземпляров
  private Config() {
    throw new UnsupportedOperationException("Utility class");
  }
}
