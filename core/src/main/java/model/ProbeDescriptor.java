package model;

import java.util.Objects;

/**
 * Единица работы планировщика: одна цель, одна пара учетных данных и необязательный путь.
 * Один дескриптор дает ровно один {@link ProbeResult}.
 *
 * @param endpoint цель проверки
 * @param credential учетные данные
 * @param checkPath путь на сервере для проверки существования, или {@code null}
 */
public record ProbeDescriptor(Endpoint endpoint, Credential credential, String checkPath) {

    public ProbeDescriptor {
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        Objects.requireNonNull(credential, "credential cannot be null");
        if (checkPath != null && checkPath.isBlank()) {
            checkPath = null;
        }
    }

    public ProbeDescriptor(Endpoint endpoint, Credential credential) {
        this(endpoint, credential, null);
    }

    public boolean hasCheckPath() {
        return checkPath != null;
    }

    public Protocol protocol() {
        return endpoint.protocol();
    }

    @Override
    public String toString() {
        return credential.username() + "@" + endpoint.host() + ":" + endpoint.port() + " (" + endpoint.protocol() + ")";
    }
}
