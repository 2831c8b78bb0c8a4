package com.webcrawler.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.webcrawler.core.api.PageCallback;
import com.webcrawler.core.model.FetchRequest;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 페이지 결과를 한 줄 JSON으로 기록: {"url","ok","error","parsed"}.
 * 워커 여러 개가 동시에 부르므로 write는 직렬화한다.
 */
public final class JsonlResultWriter implements PageCallback, Closeable {

    private final ObjectMapper om = new ObjectMapper();
    private final Writer out;
    private long lines;

    public JsonlResultWriter(Writer out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public static JsonlResultWriter open(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new JsonlResultWriter(w);
    }

    @Override
    public void onPage(FetchRequest request, Object parsed, Throwable error) {
        ObjectNode node = om.createObjectNode();
        node.put("url", request.getUrl());
        node.put("ok", error == null);
        if (error == null) node.putNull("error");
        else node.put("error", describe(error));
        if (parsed == null) node.putNull("parsed");
        else node.set("parsed", om.valueToTree(parsed));

        try {
            String line = om.writeValueAsString(node);
            synchronized (this) {
                out.write(line);
                out.write('\n');
                lines++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write result for " + request.getUrl(), e);
        }
    }

    public synchronized long lineCount() { return lines; }

    @Override
    public synchronized void close() throws IOException {
        out.close();
    }

    static String describe(Throwable t) {
        String msg = t.getMessage();
        if (t.getCause() != null && t.getCause().getMessage() != null && (msg == null || msg.isBlank())) {
            msg = t.getCause().getMessage();
        }
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }
}
