package model;

/**
 * Тип удаленного пути, определенный при проверке.
 */
public enum PathType {
    FILE("file"),
    DIRECTORY("directory");

    private final String displayName;

    PathType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
