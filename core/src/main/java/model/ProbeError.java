package model;

import java.util.Objects;

/**
 * Ошибка, накопленная во время проверки.
 *
 * @param kind категория ошибки
 * @param message человекочитаемое описание
 */
public record ProbeError(ErrorKind kind, String message) {

    public ProbeError {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    @Override
    public String toString() {
        return message;
    }
}
