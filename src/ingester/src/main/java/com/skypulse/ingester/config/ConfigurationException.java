package com.skypulse.ingester.config;

/** Invalid or missing configuration detected at startup. Fatal: the context refuses to start. */
public class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
