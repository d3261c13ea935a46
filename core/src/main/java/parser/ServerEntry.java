package parser;

import model.Credential;
import model.Endpoint;
import model.ProbeDescriptor;
import model.Protocol;

/**
 * Сервер из экспорта FileZilla с уже декодированным паролем.
 *
 * @param name отображаемое имя ({@code Name} или {@code user@host:port})
 * @param host хост
 * @param port порт
 * @param protocol протокол
 * @param username имя пользователя
 * @param password пароль в открытом виде
 * @param logonType тип входа FileZilla
 */
public record ServerEntry(String name, String host, int port, Protocol protocol,
                          String username, String password, String logonType) {

    public ProbeDescriptor toDescriptor(String checkPath) {
        return new ProbeDescriptor(new Endpoint(host, port, protocol), new Credential(username, password), checkPath);
    }
}
