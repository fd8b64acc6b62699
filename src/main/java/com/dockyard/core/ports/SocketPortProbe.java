package com.dockyard.core.ports;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;

/**
 * {@link PortProbe} that tries to bind a {@link ServerSocket} on 127.0.0.1.
 */
public class SocketPortProbe implements PortProbe {

    private static final InetAddress LOOPBACK = InetAddress.getLoopbackAddress();

    @Override
    public boolean isAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port, 1, LOOPBACK)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public int ephemeralPort() {
        try (ServerSocket socket = new ServerSocket(0, 1, LOOPBACK)) {
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to obtain an ephemeral port", e);
        }
    }
}
