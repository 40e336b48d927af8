package ru.aritmos.padlock.config;

/**
 * Реакция на проблемы конфигурации, обнаруженные при старте.
 */
public enum InvalidConfigurationMode {
    /** игнорировать */
    SILENT,
    /** записать предупреждение в лог и продолжить */
    WARN,
    /** не запускаться */
    ERROR
}
