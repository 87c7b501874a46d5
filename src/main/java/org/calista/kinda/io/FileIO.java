package org.calista.kinda.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO: файловый слой трансформера и журнала событий.
 *
 * <p>Всё, что пишется, лежит под {@code baseDir} ({@link #resolve} не выпускает наружу).
 * Исходники читаются как есть, переводы строк не трогаются. Сгенерированный код
 * коммитится через соседний .tmp и move; неизменённый файл не перезаписывается,
 * чтобы не сбивать инкрементальную сборку.</p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private static final String TMP_SUFFIX = ".kinda-tmp";

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    // appends to the event log come from any thread that runs a fuzzy construct
    private final Object appendLock = new Object();

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create base directory " + this.baseDir, e);
        }
        log.debug("FileIO: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
    }

    public Path baseDir() {
        return baseDir;
    }

    public Charset charset() {
        return charset;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Путь внутри baseDir.
     *
     * @throws IllegalArgumentException для абсолютного пути или выхода через ".."
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Path.of(relative.replace('\\', '/'));
        if (rel.isAbsolute()) {
            throw new IllegalArgumentException("expected a path relative to " + baseDir + ": " + relative);
        }
        Path p = baseDir.resolve(rel).normalize();
        if (!p.startsWith(baseDir)) {
            throw new IllegalArgumentException("path escapes " + baseDir + ": " + relative);
        }
        return p;
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    /**
     * Пишет файл целиком, создавая родительские каталоги. Одинаковое содержимое не переписывается.
     */
    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        createParents(file);

        if (unchanged(file, content)) {
            log.trace("writeString: {} unchanged", file);
            return;
        }
        if (!atomicWrites) {
            Files.writeString(file, content, charset);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName() + TMP_SUFFIX);
        Files.writeString(tmp, content, charset);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.trace("writeString: atomic move unsupported for {}, plain replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** @return true when a file was there */
    public boolean delete(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        boolean deleted = Files.deleteIfExists(file);
        if (deleted) log.debug("delete: {}", file);
        return deleted;
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    /**
     * Дописывает одну запись. Пустая строка игнорируется.
     *
     * @throws IllegalArgumentException если запись занимает больше одной строки
     */
    public void appendJsonl(Path file, String record) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(record, "record");
        String s = record.trim();
        if (s.isEmpty()) return;
        if (s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("JSONL record must be a single line");
        }
        synchronized (appendLock) {
            createParents(file);
            Files.writeString(file, s + "\n", charset,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        }
    }

    /** Непустые записи по порядку; нет файла - пустой список. */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return List.of();
        try (Stream<String> lines = Files.lines(file, charset)) {
            return lines.map(String::trim).filter(l -> !l.isEmpty()).collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Listing
    // ----------------------------

    /**
     * Обычные файлы под dir, имя которых оканчивается на suffix (регистр не важен), по порядку путей.
     * Нет каталога: пустой список.
     */
    public List<Path> walk(Path dir, String suffix) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(suffix, "suffix");
        if (!Files.isDirectory(dir)) return List.of();

        String want = suffix.toLowerCase(Locale.ROOT);
        try (Stream<Path> s = Files.walk(dir)) {
            List<Path> found = s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(want))
                    .sorted()
                    .collect(Collectors.toList());
            log.debug("walk: {} -> {} file(s) matching '{}'", dir, found.size(), suffix);
            return found;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static void createParents(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private boolean unchanged(Path file, String content) throws IOException {
        if (!Files.isRegularFile(file)) return false;
        byte[] want = content.getBytes(charset);
        if (Files.size(file) != want.length) return false;
        return Arrays.equals(Files.readAllBytes(file), want);
    }
}
