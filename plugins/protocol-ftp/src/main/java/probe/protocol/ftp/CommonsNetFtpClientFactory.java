package probe.protocol.ftp;

import model.Protocol;
import probe.protocol.FtpClient;
import probe.protocol.ProtocolClientFactory;

/**
 * Registered through {@code META-INF/services/probe.protocol.ProtocolClientFactory}.
 */
public class CommonsNetFtpClientFactory implements ProtocolClientFactory<FtpClient> {

    @Override
    public Protocol getProtocol() {
        return Protocol.FTP;
    }

    @Override
    public FtpClient createClient() {
        return new CommonsNetFtpClient();
    }

    @Override
    public String getDescription() {
        return "Apache Commons Net FTP";
    }
}
