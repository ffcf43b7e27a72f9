package component.score;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * ScoreBoard
 * -----------------------
 * - 게임별 하이스코어 저장소 (JSON 파일, 모든 게임이 한 파일 공유)
 * - 첫 접근 시 파일을 읽는다
 * - 깨진 파일은 <파일명>.bak 으로 옮기고 빈 상태로 시작한다
 * - 파일 입출력 실패는 UncheckedIOException 으로 호출자에게 넘긴다
 */
public class ScoreBoard {

    public static final int MAX_ENTRIES = 10;

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private static final Type ENTRY_LIST = new TypeToken<List<ScoreEntry>>() {}.getType();

    private static final Comparator<ScoreEntry> RANKING =
            Comparator.comparingInt(ScoreEntry::score).reversed()
                    .thenComparingLong(ScoreEntry::createdAt);

    private final Path file;           // null 이면 메모리 전용
    private final LongSupplier clock;
    private final List<ScoreEntry> entries = new ArrayList<>();
    private boolean loaded = false;

    public ScoreBoard(Path file, LongSupplier clock) {
        this.file = file;
        this.clock = clock;
    }

    public static ScoreBoard createDefault() {
        Path dir = Path.of(System.getProperty("user.home"), ".block-puzzle");
        return new ScoreBoard(dir.resolve("scores.json"), System::currentTimeMillis);
    }

    public static ScoreBoard atPath(Path file) {
        return new ScoreBoard(file, System::currentTimeMillis);
    }

    public static ScoreBoard inMemory() {
        return new ScoreBoard(null, System::currentTimeMillis);
    }

    // ============================================
    // 조회
    // ============================================

    /** 해당 게임의 기록이 10개 미만이거나 10위보다 높으면 true */
    public synchronized boolean isHighScore(String gameId, int score) {
        List<ScoreEntry> top = getHighScores(gameId, MAX_ENTRIES);
        if (top.size() < MAX_ENTRIES) {
            return true;
        }
        return score > top.get(top.size() - 1).score();
    }

    public synchronized List<ScoreEntry> getHighScores(String gameId, int limit) {
        ensureLoaded();
        return entries.stream()
                .filter(e -> e.gameId().equals(gameId))
                .sorted(RANKING)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public synchronized List<ScoreEntry> getAllHighScores(int limit) {
        ensureLoaded();
        return entries.stream()
                .sorted(RANKING)
                .limit(limit)
                .collect(Collectors.toList());
    }

    // ============================================
    // 변경
    // ============================================

    /**
     * @return 해당 게임 내 순위 (0부터), 10위 밖이면 -1
     */
    public synchronized int saveScore(String name, int score, String gameId) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (gameId == null || gameId.isBlank()) {
            throw new IllegalArgumentException("gameId must not be blank");
        }
        ensureLoaded();

        ScoreEntry entry = new ScoreEntry(name.trim(), score, gameId, clock.getAsLong());
        entries.add(entry);
        persist();

        int rank = getHighScores(gameId, MAX_ENTRIES).indexOf(entry);
        System.out.println("[ScoreBoard] saved " + entry + " rank=" + rank);
        return rank;
    }

    public synchronized void clearScores(String gameId) {
        ensureLoaded();
        entries.removeIf(e -> e.gameId().equals(gameId));
        persist();
    }

    public synchronized void clearAll() {
        ensureLoaded();
        entries.clear();
        persist();
    }

    // ============================================
    // 파일
    // ============================================
    private void ensureLoaded() {
        if (loaded) return;
        loaded = true;
        if (file == null || !Files.exists(file)) {
            return;
        }
        boolean corrupted = false;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<ScoreEntry> read = gson.fromJson(reader, ENTRY_LIST);
            if (read != null) {
                for (ScoreEntry e : read) {
                    if (e != null && e.gameId() != null && e.name() != null) {
                        entries.add(e);
                    }
                }
            }
            System.out.println("[ScoreBoard] loaded " + entries.size() + " entries from " + file);
        } catch (JsonParseException e) {
            System.err.println("[ScoreBoard] corrupted score file " + file + ": " + e.getMessage());
            entries.clear();
            corrupted = true;
        } catch (IOException e) {
            loaded = false;
            throw new UncheckedIOException("cannot read " + file, e);
        }
        if (corrupted) {
            backUpCorrupted();
        }
    }

    /** 깨진 파일은 덮어쓰기 전에 .bak 으로 옮겨 둔다 */
    private void backUpCorrupted() {
        Path backup = file.resolveSibling(file.getFileName() + ".bak");
        try {
            Files.move(file, backup, StandardCopyOption.REPLACE_EXISTING);
            System.err.println("[ScoreBoard] moved corrupted file to " + backup);
        } catch (IOException e) {
            loaded = false;
            throw new UncheckedIOException("cannot move corrupted " + file + " aside", e);
        }
    }

    private void persist() {
        if (file == null) return;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                gson.toJson(entries, ENTRY_LIST, writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write " + file, e);
        }
    }
}
