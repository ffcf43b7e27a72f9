package component.score;

/** 하이스코어 달성 시 이름 입력 (null 또는 빈 문자열이면 건너뛰기) */
@FunctionalInterface
public interface NamePrompt {
    String askName(int score);
}
