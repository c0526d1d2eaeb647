package io.github.gitstore.git;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Considers the machine online if a well-known host name resolves. */
public final class DnsConnectivityProbe implements ConnectivityProbe {
    private static final Logger logger = LogManager.getLogger(DnsConnectivityProbe.class);

    private final String host;

    public DnsConnectivityProbe(String host) {
        this.host = host;
    }

    @Override
    public boolean isOnline() {
        try {
            InetAddress.getByName(host);
            return true;
        } catch (UnknownHostException e) {
            logger.debug("Cannot resolve {}, assuming offline", host);
            return false;
        }
    }
}
