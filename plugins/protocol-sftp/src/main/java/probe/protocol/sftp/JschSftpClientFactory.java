package probe.protocol.sftp;

import model.Protocol;
import probe.protocol.ProtocolClientFactory;
import probe.protocol.SftpClient;

/**
 * Registered through {@code META-INF/services/probe.protocol.ProtocolClientFactory}.
 */
public class JschSftpClientFactory implements ProtocolClientFactory<SftpClient> {

    @Override
    public Protocol getProtocol() {
        return Protocol.SFTP;
    }

    @Override
    public SftpClient createClient() {
        return new JschSftpClient();
    }

    @Override
    public String getDescription() {
        return "JSch SFTP";
    }
}
