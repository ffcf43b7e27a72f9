package component.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * 사용자 설정 (키 매핑, 점수 파일 위치).
 * JSON 파일로 저장하며, 없거나 깨져 있으면 classpath 의 settings.json 기본값을 쓴다.
 */
public class Settings {

    public enum Action { Left, Right, SoftDrop, HardDrop, Rotate, Pause }

    private static final String DEFAULTS_RESOURCE = "/settings.json";
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public Map<Action, String> keymap = new EnumMap<>(Action.class);
    public String scoreFile = "scores.json";

    // ============================================
    // 로드 / 저장
    // ============================================

    /** 번들된 기본 설정 */
    public static Settings defaults() {
        try (InputStream in = Settings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    Settings s = gson.fromJson(reader, Settings.class);
                    if (s != null) {
                        return s.normalize(builtIn());
                    }
                }
            }
        } catch (IOException | JsonParseException e) {
            System.err.println("[Settings] bundled defaults unreadable, using built-in: " + e.getMessage());
        }
        return builtIn();
    }

    /** file 이 없거나 읽을 수 없으면 기본값 */
    public static Settings load(Path file) {
        Settings base = defaults();
        if (file == null || !Files.exists(file)) {
            return base;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Settings s = gson.fromJson(reader, Settings.class);
            if (s == null) {
                System.err.println("[Settings] empty settings file " + file + ", using defaults");
                return base;
            }
            System.out.println("[Settings] loaded " + file);
            return s.normalize(base);
        } catch (IOException | JsonParseException e) {
            System.err.println("[Settings] failed to read " + file + ": " + e.getMessage() + " (using defaults)");
            return base;
        }
    }

    public void save(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                gson.toJson(this, writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot save settings to " + file, e);
        }
    }

    public void update(Consumer<Settings> change) {
        change.accept(this);
        normalize(builtIn());
    }

    public void resetToDefaults() {
        Settings d = defaults();
        keymap = new EnumMap<>(d.keymap);
        scoreFile = d.scoreFile;
    }

    /** 두 개 이상의 액션에 묶인 키 이름 */
    public Set<String> findDuplicateKeys() {
        Map<String, Action> used = new HashMap<>();
        Set<String> dupes = new TreeSet<>();
        for (var e : keymap.entrySet()) {
            Action clash = used.putIfAbsent(e.getValue(), e.getKey());
            if (clash != null) {
                dupes.add(e.getValue());
            }
        }
        return dupes;
    }

    public String keyFor(Action action) {
        return keymap.get(action);
    }

    // ============================================
    // 내부
    // ============================================
    private static Settings builtIn() {
        Settings s = new Settings();
        s.keymap.put(Action.Left, "LEFT");
        s.keymap.put(Action.Right, "RIGHT");
        s.keymap.put(Action.SoftDrop, "DOWN");
        s.keymap.put(Action.Rotate, "UP");
        s.keymap.put(Action.HardDrop, "SPACE");
        s.keymap.put(Action.Pause, "P");
        return s;
    }

    /** 빠진 항목은 fallback 으로 채우고 키 이름은 대문자로 */
    private Settings normalize(Settings fallback) {
        Map<Action, String> fixed = new EnumMap<>(Action.class);
        if (keymap != null) {
            keymap.forEach((action, key) -> {
                // 알 수 없는 액션 이름은 Gson 이 null 키로 넘긴다
                if (action != null && key != null && !key.isBlank()) {
                    fixed.put(action, normalizeKey(key));
                }
            });
        }
        for (Action a : Action.values()) {
            fixed.putIfAbsent(a, fallback.keymap.get(a));
        }
        keymap = fixed;
        if (scoreFile == null || scoreFile.isBlank()) {
            scoreFile = fallback.scoreFile;
        }
        return this;
    }

    public static String normalizeKey(String key) {
        return key.trim().toUpperCase(Locale.ROOT);
    }
}
