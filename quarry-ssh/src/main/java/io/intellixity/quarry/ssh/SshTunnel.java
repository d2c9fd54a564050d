package io.intellixity.quarry.ssh;

import io.intellixity.quarry.core.config.SshConfig;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelDirectTcpip;
import org.apache.sshd.client.future.ConnectFuture;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.client.session.ClientSession.ClientSessionEvent;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.apache.sshd.common.util.net.SshdSocketAddress;
import org.apache.sshd.core.CoreModuleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.KeyPair;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local port forward through an authenticated SSH session.\n
 *
 * {@link #open} connects, authenticates (key first, then password) and binds a loopback listener on an
 * ephemeral port. A background accept loop opens one direct-tcpip channel per local connection and copies
 * bytes both ways until either side closes. Opening a channel is serialized on a lock; the copying is not.
 * {@link #close()} is the one-shot shutdown signal: the accept loop exits and every live forward is torn
 * down with the session.\n
 */
public final class SshTunnel implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(SshTunnel.class);

  public static final String LOCAL_HOST = "127.0.0.1";
  private static final SshdSocketAddress LOCAL_ORIGIN = new SshdSocketAddress(LOCAL_HOST, 0);
  private static final AtomicInteger SEQ = new AtomicInteger();
  private static final int COPY_BUFFER = 8192;

  private final SshClient client;
  private final ClientSession session;
  private final ServerSocket listener;
  private final SshdSocketAddress remote;
  private final Duration timeout;
  private final ReentrantLock channelOpenLock = new ReentrantLock();
  private final Set<Closeable> live = ConcurrentHashMap.newKeySet();
  private final ExecutorService workers;
  private final CountDownLatch shutdown = new CountDownLatch(1);

  private SshTunnel(SshClient client, ClientSession session, ServerSocket listener, String remoteHost,
                    int remotePort, Duration timeout) {
    this.client = client;
    this.session = session;
    this.listener = listener;
    this.remote = new SshdSocketAddress(remoteHost, remotePort);
    this.timeout = timeout;
    int id = SEQ.incrementAndGet();
    AtomicInteger n = new AtomicInteger();
    this.workers = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "quarry-ssh-tunnel-" + id + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Opens a tunnel to {@code remoteHost:remotePort} as seen from the SSH host.
   *
   * @param timeout deadline for each of connect, handshake and authentication
   * @param keepAlive interval of SSH-level heartbeats on the idle session
   * @throws SshTunnelException with a distinct message per failing stage
   */
  public static SshTunnel open(SshConfig ssh, String remoteHost, int remotePort, Duration timeout, Duration keepAlive) {
    Objects.requireNonNull(ssh, "ssh");
    Objects.requireNonNull(remoteHost, "remoteHost");
    if (!ssh.enabled()) throw new SshTunnelException("SSH is not enabled for this connection");

    InetSocketAddress sshAddress = resolve(ssh.host(), ssh.effectivePort());

    SshClient client = SshClient.setUpDefaultClient();
    CoreModuleProperties.HEARTBEAT_INTERVAL.set(client, keepAlive);
    client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
    client.start();

    ClientSession session = null;
    ServerSocket listener = null;
    try {
      session = connect(client, ssh, sshAddress, timeout);
      authenticate(session, ssh, timeout);
      listener = bindLocal();

      SshTunnel tunnel = new SshTunnel(client, session, listener, remoteHost, remotePort, timeout);
      tunnel.workers.execute(tunnel::acceptLoop);
      log.info("quarry.ssh tunnel_open sshHost={} sshPort={} remote={}:{} localPort={}",
          ssh.host(), ssh.effectivePort(), remoteHost, remotePort, listener.getLocalPort());
      return tunnel;
    } catch (RuntimeException e) {
      closeQuietly(listener, "listener");
      closeQuietly(session, "session");
      client.stop();
      throw e;
    }
  }

  public String localHost() { return LOCAL_HOST; }

  public int localPort() { return listener.getLocalPort(); }

  public boolean isOpen() { return shutdown.getCount() > 0 && session.isOpen(); }

  /** Fires the shutdown signal. Idempotent. */
  @Override
  public void close() {
    if (shutdown.getCount() == 0) return;
    shutdown.countDown();
    closeQuietly(listener, "listener");
    for (Closeable c : live) closeQuietly(c, "forward");
    live.clear();
    workers.shutdownNow();
    closeQuietly(session, "session");
    client.stop();
    log.info("quarry.ssh tunnel_closed localPort={}", listener.getLocalPort());
  }

  static InetSocketAddress resolve(String host, int port) {
    if (host == null || host.isBlank()) {
      throw new SshTunnelException("Invalid SSH address: host is required");
    }
    InetSocketAddress addr = new InetSocketAddress(host, port);
    if (addr.isUnresolved()) {
      throw new SshTunnelException("Invalid SSH address: " + host + ":" + port);
    }
    return addr;
  }

  /** Expands a leading {@code ~} to the user's home directory. */
  static Path expandHome(String path) {
    if (path.equals("~")) return Paths.get(System.getProperty("user.home"));
    if (path.startsWith("~/")) return Paths.get(System.getProperty("user.home"), path.substring(2));
    return Paths.get(path);
  }

  private static ClientSession connect(SshClient client, SshConfig ssh, InetSocketAddress address, Duration timeout) {
    ClientSession session;
    try {
      ConnectFuture cf = client.connect(ssh.user(), address);
      session = cf.verify(timeout.toMillis()).getSession();
    } catch (IOException e) {
      throw new SshTunnelException("Failed to connect to SSH server: " + message(e), e);
    }

    Set<ClientSessionEvent> state = session.waitFor(
        EnumSet.of(ClientSessionEvent.WAIT_AUTH, ClientSessionEvent.AUTHED, ClientSessionEvent.CLOSED),
        timeout.toMillis());
    if (state.contains(ClientSessionEvent.CLOSED) || state.contains(ClientSessionEvent.TIMEOUT)) {
      closeQuietly(session, "session");
      throw new SshTunnelException("SSH handshake failed: " + (state.contains(ClientSessionEvent.TIMEOUT)
          ? "no key exchange within " + timeout.toSeconds() + " seconds" : "session closed by server"));
    }
    return session;
  }

  private static void authenticate(ClientSession session, SshConfig ssh, Duration timeout) {
    boolean keyLoaded = false;
    if (ssh.hasKey()) {
      Path key = expandHome(ssh.keyPath());
      try {
        for (KeyPair kp : new FileKeyPairProvider(key).loadKeys(session)) {
          session.addPublicKeyIdentity(kp);
          keyLoaded = true;
        }
      } catch (RuntimeException e) {
        // key parsing is lazy and wraps its failures unchecked
        if (!ssh.hasPassword()) {
          throw new SshTunnelException("Failed to read SSH key " + key + ": " + message(e), e);
        }
        log.warn("quarry.ssh key_unreadable path={} reason={} fallback=password", key, message(e));
      }
      if (!keyLoaded && !Files.exists(key)) {
        log.warn("quarry.ssh key_missing path={}", key);
      }
    }
    if (ssh.hasPassword()) session.addPasswordIdentity(ssh.password());
    if (!keyLoaded && !ssh.hasPassword()) {
      throw new SshTunnelException("SSH authentication failed - check credentials");
    }

    try {
      session.auth().verify(timeout.toMillis());
    } catch (IOException e) {
      String msg = keyLoaded
          ? "SSH authentication failed - check credentials"
          : "SSH password authentication failed: " + message(e);
      throw new SshTunnelException(msg, e);
    }
  }

  private static ServerSocket bindLocal() {
    try {
      ServerSocket s = new ServerSocket();
      s.bind(new InetSocketAddress(InetAddress.getByName(LOCAL_HOST), 0));
      return s;
    } catch (IOException e) {
      throw new SshTunnelException("Failed to bind local port: " + message(e), e);
    }
  }

  private void acceptLoop() {
    while (shutdown.getCount() > 0) {
      Socket socket;
      try {
        socket = listener.accept();
      } catch (IOException e) {
        if (shutdown.getCount() > 0) {
          log.warn("quarry.ssh accept_failed localPort={} reason={}", listener.getLocalPort(), message(e));
        }
        return;
      }
      workers.execute(() -> forward(socket));
    }
  }

  private void forward(Socket socket) {
    live.add(socket);
    ChannelDirectTcpip channel;
    try {
      channel = openChannel();
    } catch (IOException e) {
      log.warn("quarry.ssh channel_open_failed remote={} reason={}", remote, message(e));
      live.remove(socket);
      closeQuietly(socket, "socket");
      return;
    }
    live.add(channel);

    workers.execute(() -> {
      try {
        OutputStream out = channel.getInvertedIn();
        pump(socket.getInputStream(), out);
        // local half-close: pass EOF on, keep reading the reply
        out.close();
      } catch (IOException e) {
        log.debug("quarry.ssh upstream_closed remote={} reason={}", remote, message(e));
      }
    });

    try {
      InputStream in = channel.getInvertedOut();
      pump(in, socket.getOutputStream());
    } catch (IOException e) {
      log.debug("quarry.ssh downstream_closed remote={} reason={}", remote, message(e));
    } finally {
      live.remove(channel);
      live.remove(socket);
      closeQuietly(channel, "channel");
      closeQuietly(socket, "socket");
    }
  }

  /**
   * Copies until EOF, flushing after every read. The channel stream buffers until flushed, and
   * request/response clients wait for a reply without closing their side.
   */
  static void pump(InputStream in, OutputStream out) throws IOException {
    byte[] buf = new byte[COPY_BUFFER];
    int n;
    while ((n = in.read(buf)) != -1) {
      out.write(buf, 0, n);
      out.flush();
    }
  }

  /** The session cannot open channels concurrently; hold the lock for the open only. */
  private ChannelDirectTcpip openChannel() throws IOException {
    channelOpenLock.lock();
    try {
      ChannelDirectTcpip channel = session.createDirectTcpipChannel(LOCAL_ORIGIN, remote);
      channel.open().verify(timeout.toMillis());
      return channel;
    } finally {
      channelOpenLock.unlock();
    }
  }

  private static void closeQuietly(Closeable c, String what) {
    if (c == null) return;
    try {
      c.close();
    } catch (IOException e) {
      log.debug("quarry.ssh close_failed what={} reason={}", what, message(e));
    }
  }

  private static String message(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
