package probe.protocol.ftp;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Однопоточный FTP сервер для тестов: отвечает на управляющие команды
 * заранее заданными ответами, без каналов данных.
 */
final class ScriptedFtpServer implements AutoCloseable {

    private final ServerSocket serverSocket;
    private final String greeting;
    private final Map<String, String> replies = new ConcurrentHashMap<>();
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final Thread thread;

    ScriptedFtpServer(String greeting) throws IOException {
        this.serverSocket = new ServerSocket(0);
        this.greeting = greeting;
        reply("QUIT", "221 Goodbye");
        this.thread = new Thread(this::serve, "scripted-ftp");
        this.thread.setDaemon(true);
    }

    /**
     * @param commandKey команда с аргументом ("PASS secret") или без ("FEAT")
     * @param response полный ответ, строки разделены \r\n
     */
    ScriptedFtpServer reply(String commandKey, String response) {
        replies.put(commandKey, response);
        return this;
    }

    ScriptedFtpServer start() {
        thread.start();
        return this;
    }

    int getPort() {
        return serverSocket.getLocalPort();
    }

    List<String> getReceived() {
        return received;
    }

    private void serve() {
        try (Socket socket = serverSocket.accept();
             BufferedReader in = new BufferedReader(
                 new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
             Writer out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8)) {
            send(out, greeting);
            String line;
            while ((line = in.readLine()) != null) {
                received.add(line);
                String verb = line.split(" ", 2)[0].toUpperCase(Locale.ROOT);
                String response = replies.getOrDefault(line, replies.getOrDefault(verb, "502 Command not implemented"));
                send(out, response);
                if (verb.equals("QUIT")) {
                    return;
                }
            }
        } catch (IOException e) {
            // клиент закрыл соединение
        }
    }

    private static void send(Writer out, String response) throws IOException {
        out.write(response + "\r\n");
        out.flush();
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
    }
}
