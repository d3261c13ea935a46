package model;

import java.util.Objects;

/**
 * Сетевая цель проверки: хост, порт и протокол. Не зависит от учетных данных.
 *
 * @param host имя хоста или IP-адрес
 * @param port TCP-порт
 * @param protocol протокол сервера
 */
public record Endpoint(String host, int port, Protocol protocol) {

    public Endpoint {
        Objects.requireNonNull(host, "host cannot be null");
        Objects.requireNonNull(protocol, "protocol cannot be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host cannot be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Создает цель на стандартном порту протокола.
     */
    public static Endpoint of(String host, Protocol protocol) {
        return new Endpoint(host, protocol.getDefaultPort(), protocol);
    }

    @Override
    public String toString() {
        return host + ":" + port + " (" + protocol + ")";
    }
}
