package component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import component.config.Settings;
import logic.BoardLogic;

/**
 * 키 이름 → 엔진 명령 1:1 매핑.
 * UI 프레임워크와 무관: 화면 쪽에서 자기 키 이벤트를 키 이름("LEFT", "SPACE", "P" ...)으로 넘긴다.
 */
public class GameController {
    private final BoardLogic logic;
    private final Runnable repaint;
    private volatile Map<String, Settings.Action> bindings = Map.of();   // 교체만, 수정하지 않음

    public GameController(BoardLogic logic, Runnable repaint) {
        this(logic, Settings.defaults().keymap, repaint);
    }

    public GameController(BoardLogic logic, Map<Settings.Action, String> keymap, Runnable repaint) {
        this.logic = logic;
        this.repaint = (repaint != null) ? repaint : () -> {};
        updateKeyBindings(keymap);
    }

    /**
     * @return 상태가 바뀌었으면 true (이때만 repaint)
     */
    public boolean handleKey(String key) {
        if (key == null) return false;

        Settings.Action action = bindings.get(Settings.normalizeKey(key));
        if (action == null) {
            return false;
        }
        boolean changed = perform(action);
        if (changed) {
            repaint.run();
        }
        return changed;
    }

    public boolean perform(Settings.Action action) {
        return switch (action) {
            case Left -> logic.moveLeft();
            case Right -> logic.moveRight();
            case SoftDrop -> logic.moveDown();
            case Rotate -> logic.rotate();
            case HardDrop -> logic.hardDrop();
            case Pause -> logic.togglePause();
        };
    }

    /** 🔧 Settings 재바인딩용 */
    public void updateKeyBindings(Map<Settings.Action, String> keymap) {
        Map<String, Settings.Action> next = new HashMap<>();
        keymap.forEach((action, key) -> {
            if (key != null) {
                next.put(Settings.normalizeKey(key), action);
            }
        });
        bindings = Collections.unmodifiableMap(next);
        System.out.println("[GameController] Key bindings set: " + keymap);
    }

    public Settings.Action actionFor(String key) {
        return key == null ? null : bindings.get(Settings.normalizeKey(key));
    }
}
