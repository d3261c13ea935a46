package model;

/**
 * Категории ошибок, фиксируемых в результате проверки как данные.
 */
public enum ErrorKind {
    /** Истекло время ожидания соединения */
    CONNECTION_TIMEOUT,

    /** Не удалось разрешить имя хоста */
    HOSTNAME_RESOLUTION_FAILURE,

    /** Соединение отклонено или ошибка протокола при подключении */
    CONNECTION_REFUSED_OR_PROTOCOL_ERROR,

    /** Неверные учетные данные */
    AUTHENTICATION_FAILURE,

    /** Ошибка протокола посреди сессии */
    TRANSPORT_PROTOCOL_ERROR,

    /** Путь не найден или недоступен */
    PATH_CHECK_ERROR,

    /** Все остальное */
    UNEXPECTED_ERROR
}
