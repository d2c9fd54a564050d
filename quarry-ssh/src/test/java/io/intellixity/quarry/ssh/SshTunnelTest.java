package io.intellixity.quarry.ssh;

import io.intellixity.quarry.core.config.SshConfig;
import io.intellixity.quarry.core.error.DriverConnectionException;
import org.apache.sshd.common.config.keys.KeyUtils;
import org.apache.sshd.common.config.keys.writer.openssh.OpenSSHKeyPairResourceWriter;
import org.apache.sshd.server.SshServer;
import org.apache.sshd.server.forward.AcceptAllForwardingFilter;
import org.apache.sshd.server.keyprovider.SimpleGeneratorHostKeyProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

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
import java.security.KeyPairGenerator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

final class SshTunnelTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(10);
  private static final Duration KEEP_ALIVE = Duration.ofSeconds(15);

  @TempDir Path dir;

  private SshServer sshd;
  private ServerSocket echo;
  private final ExecutorService echoPool = Executors.newCachedThreadPool();
  private KeyPair authorizedKey;

  @BeforeEach
  void start() throws Exception {
    authorizedKey = rsa();

    sshd = SshServer.setUpDefaultServer();
    sshd.setHost("127.0.0.1");
    sshd.setPort(0);
    sshd.setKeyPairProvider(new SimpleGeneratorHostKeyProvider());
    sshd.setForwardingFilter(AcceptAllForwardingFilter.INSTANCE);
    sshd.setPasswordAuthenticator((user, pw, session) -> "tester".equals(user) && "secret".equals(pw));
    sshd.setPublickeyAuthenticator((user, key, session) ->
        "tester".equals(user) && KeyUtils.compareKeys(key, authorizedKey.getPublic()));
    sshd.start();

    echo = new ServerSocket();
    echo.bind(new InetSocketAddress(InetAddress.getByName("127.0.0.1"), 0));
    echoPool.execute(this::echoLoop);
  }

  @AfterEach
  void stop() throws IOException {
    echo.close();
    echoPool.shutdownNow();
    sshd.stop(true);
  }

  private void echoLoop() {
    while (!echo.isClosed()) {
      try {
        Socket s = echo.accept();
        echoPool.execute(() -> {
          try (s; InputStream in = s.getInputStream(); OutputStream out = s.getOutputStream()) {
            in.transferTo(out);
          } catch (IOException e) {
            // peer went away
          }
        });
      } catch (IOException e) {
        return;
      }
    }
  }

  private SshConfig password(String pw) {
    return SshConfig.withPassword("127.0.0.1", sshd.getPort(), "tester", pw);
  }

  private SshTunnel open(SshConfig ssh) {
    return SshTunnel.open(ssh, "127.0.0.1", echo.getLocalPort(), TIMEOUT, KEEP_ALIVE);
  }

  private static KeyPair rsa() throws Exception {
    KeyPairGenerator g = KeyPairGenerator.getInstance("RSA");
    g.initialize(2048);
    return g.generateKeyPair();
  }

  private Path writeKey(KeyPair kp, String name) throws Exception {
    Path p = dir.resolve(name);
    try (OutputStream out = Files.newOutputStream(p)) {
      OpenSSHKeyPairResourceWriter.INSTANCE.writePrivateKey(kp, "quarry-test", null, out);
    }
    return p;
  }

  private static byte[] roundTrip(int localPort, byte[] payload) throws IOException {
    try (Socket s = new Socket("127.0.0.1", localPort)) {
      s.setSoTimeout(10_000);
      OutputStream out = s.getOutputStream();
      out.write(payload);
      out.flush();
      byte[] back = new byte[payload.length];
      InputStream in = s.getInputStream();
      int read = 0;
      while (read < back.length) {
        int n = in.read(back, read, back.length - read);
        if (n < 0) break;
        read += n;
      }
      assertEquals(payload.length, read);
      return back;
    }
  }

  @Test
  void shortRequestsGetRepliesWhileTheClientKeepsWriting() throws Exception {
    try (SshTunnel tunnel = open(password("secret"));
         Socket s = new Socket("127.0.0.1", tunnel.localPort())) {
      s.setSoTimeout(5_000);
      OutputStream out = s.getOutputStream();
      InputStream in = s.getInputStream();
      for (String req : List.of("ping", "PING\r\n", "SELECT 1;")) {
        byte[] bytes = req.getBytes(java.nio.charset.StandardCharsets.US_ASCII);
        out.write(bytes);
        out.flush();
        byte[] back = in.readNBytes(bytes.length);
        assertArrayEquals(bytes, back, req);
      }
      assertFalse(s.isOutputShutdown());
    }
  }

  @Test
  void pumpFlushesEveryChunk() throws Exception {
    List<Integer> flushedAt = new ArrayList<>();
    java.io.ByteArrayOutputStream sink = new java.io.ByteArrayOutputStream() {
      @Override public void flush() {
        flushedAt.add(size());
      }
    };
    InputStream twoReads = new InputStream() {
      private final byte[][] chunks = {"ab".getBytes(), "cde".getBytes()};
      private int next;
      @Override public int read() {
        throw new UnsupportedOperationException();
      }
      @Override public int read(byte[] b, int off, int len) {
        if (next == chunks.length) return -1;
        byte[] c = chunks[next++];
        System.arraycopy(c, 0, b, off, c.length);
        return c.length;
      }
    };

    SshTunnel.pump(twoReads, sink);

    assertEquals("abcde", sink.toString());
    assertEquals(List.of(2, 5), flushedAt);
  }

  @Test
  void randomBytesSurviveTheRoundTrip() throws Exception {
    byte[] payload = new byte[256 * 1024];
    new Random(7).nextBytes(payload);

    try (SshTunnel tunnel = open(password("secret"))) {
      assertTrue(tunnel.isOpen());
      assertEquals("127.0.0.1", tunnel.localHost());
      assertTrue(tunnel.localPort() > 0);
      assertArrayEquals(payload, roundTrip(tunnel.localPort(), payload));
    }
  }

  @Test
  void simultaneousConnectionsForwardIndependently() throws Exception {
    try (SshTunnel tunnel = open(password("secret"))) {
      ExecutorService pool = Executors.newFixedThreadPool(4);
      try {
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
          int seed = i;
          results.add(pool.submit(() -> {
            byte[] payload = new byte[32 * 1024];
            new Random(seed).nextBytes(payload);
            return java.util.Arrays.equals(payload, roundTrip(tunnel.localPort(), payload));
          }));
        }
        for (Future<Boolean> f : results) assertTrue(f.get(30, TimeUnit.SECONDS));
      } finally {
        pool.shutdownNow();
      }
    }
  }

  @Test
  void keyIsTriedBeforePassword() throws Exception {
    Path key = writeKey(authorizedKey, "id_rsa");
    SshConfig ssh = new SshConfig(true, "127.0.0.1", sshd.getPort(), "tester", "wrong", key.toString());

    try (SshTunnel tunnel = open(ssh)) {
      assertArrayEquals(new byte[]{1, 2, 3}, roundTrip(tunnel.localPort(), new byte[]{1, 2, 3}));
    }
  }

  @Test
  void unreadableKeyFallsBackToPassword() throws Exception {
    Path junk = dir.resolve("not_a_key");
    Files.writeString(junk, "definitely not a private key");
    SshConfig ssh = new SshConfig(true, "127.0.0.1", sshd.getPort(), "tester", "secret", junk.toString());

    try (SshTunnel tunnel = open(ssh)) {
      assertTrue(tunnel.isOpen());
    }
  }

  @Test
  void rejectedKeyWithoutPasswordFails() throws Exception {
    Path stranger = writeKey(rsa(), "id_stranger");

    SshTunnelException e = assertThrows(SshTunnelException.class,
        () -> open(SshConfig.withKey("127.0.0.1", sshd.getPort(), "tester", stranger.toString())));

    assertEquals("SSH authentication failed - check credentials", e.getMessage());
  }

  @Test
  void wrongPasswordIsAnAuthenticationFailure() {
    SshTunnelException e = assertThrows(SshTunnelException.class, () -> open(password("nope")));

    assertTrue(e.getMessage().startsWith("SSH password authentication failed"), e.getMessage());
    assertInstanceOf(DriverConnectionException.class, e);
  }

  @Test
  void closedSshPortIsAConnectFailure() throws IOException {
    int port;
    try (ServerSocket s = new ServerSocket(0)) {
      port = s.getLocalPort();
    }

    SshTunnelException e = assertThrows(SshTunnelException.class,
        () -> open(SshConfig.withPassword("127.0.0.1", port, "tester", "secret")));

    assertTrue(e.getMessage().startsWith("Failed to connect to SSH server"), e.getMessage());
  }

  @Test
  void blankHostIsAnAddressFailure() {
    SshTunnelException e = assertThrows(SshTunnelException.class,
        () -> open(SshConfig.withPassword(" ", 22, "tester", "secret")));

    assertTrue(e.getMessage().startsWith("Invalid SSH address"), e.getMessage());
  }

  @Test
  void closeStopsTheListener() {
    SshTunnel tunnel = open(password("secret"));
    int port = tunnel.localPort();

    tunnel.close();
    tunnel.close();

    assertFalse(tunnel.isOpen());
    assertThrows(IOException.class, () -> new Socket("127.0.0.1", port).close());
  }

  @Test
  void leadingTildeExpandsToHome() {
    String home = System.getProperty("user.home");

    assertEquals(Paths.get(home, ".ssh", "id_rsa"), SshTunnel.expandHome("~/.ssh/id_rsa"));
    assertEquals(Paths.get(home), SshTunnel.expandHome("~"));
    assertEquals(Paths.get("/etc/key"), SshTunnel.expandHome("/etc/key"));
  }
}
