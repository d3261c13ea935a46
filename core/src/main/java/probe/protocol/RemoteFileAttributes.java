package probe.protocol;

/**
 * Subset of SFTP file attributes needed by the path check.
 *
 * @param permissions POSIX mode bits, or null if the server did not report them
 */
public record RemoteFileAttributes(Integer permissions) {

    private static final int S_IFMT = 0170000;
    private static final int S_IFDIR = 0040000;

    public boolean hasPermissions() {
        return permissions != null;
    }

    /**
     * @return true if the file type bits of the mode denote a directory
     */
    public boolean isDirectory() {
        return permissions != null && (permissions & S_IFMT) == S_IFDIR;
    }
}
