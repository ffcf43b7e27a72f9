package logic;

import java.util.Random;

/** 조각 생성에 쓰는 난수 공급원. 테스트에서는 고정 시퀀스를 주입한다. */
@FunctionalInterface
public interface RandomSource {

    /** 0 이상 bound 미만 */
    int nextInt(int bound);

    static RandomSource system() {
        Random random = new Random();
        return random::nextInt;
    }

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextInt;
    }
}
