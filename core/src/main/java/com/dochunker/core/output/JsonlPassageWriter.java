package com.dochunker.core.output;

import com.dochunker.core.model.Passage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * JSON Lines 출력. 열 때 파일을 비우고(실행마다 새로 작성), 레코드 한 줄마다 flush한다.
 * 중간에 끊겨도 이미 쓴 줄은 온전한 JSON이다. 비ASCII 문자는 이스케이프하지 않는다.
 */
public final class JsonlPassageWriter implements PassageSink {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;
    private final BufferedWriter out;
    private long written;
    private boolean closed;

    public JsonlPassageWriter(Path path) throws IOException {
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    @Override
    public void write(Passage passage) {
        if (closed) throw new IllegalStateException("sink closed: " + path);
        try {
            out.write(toJson(passage));
            out.write('\n');
            out.flush();
            written++;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write passage to " + path, e);
        }
    }

    static String toJson(Passage p) throws JsonProcessingException {
        return MAPPER.writeValueAsString(p);
    }

    @Override public long written() { return written; }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            out.close();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to close " + path, e);
        }
    }
}
