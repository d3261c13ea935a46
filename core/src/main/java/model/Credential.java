package model;

import java.util.Objects;

/**
 * Пара логин/пароль. Пустой пароль допустим (anonymous или пустой пароль).
 *
 * @param username имя пользователя
 * @param password пароль, может быть пустой строкой
 */
public record Credential(String username, String password) {

    public Credential {
        Objects.requireNonNull(username, "username cannot be null");
        password = password != null ? password : "";
    }

    @Override
    public String toString() {
        return "Credential{username='" + username + "'}";
    }
}
