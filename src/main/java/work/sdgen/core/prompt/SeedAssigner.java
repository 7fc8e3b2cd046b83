package work.sdgen.core.prompt;

import java.util.List;
import java.util.Random;

/**
 * Computes the seed of an image from its position in generation order.
 */
final class SeedAssigner {
    static final long BACKEND_RANDOM = -1L;

    private final SeedMode mode;
    private final long baseSeed;
    private final List<Long> sweepSeeds;
    private final boolean drawRandomSeeds;
    private final Random random;

    SeedAssigner(GenerationSettings settings, Random random) {
        this.mode = settings.seedMode();
        this.baseSeed = settings.baseSeed();
        this.sweepSeeds = settings.sweepSeeds();
        this.drawRandomSeeds = settings.drawRandomSeeds();
        this.random = random;
    }

    long seedFor(int index, int sweepSlot) {
        switch (mode) {
            case FIXED:
                return baseSeed;
            case PROGRESSIVE:
                return baseSeed + index;
            case SWEEP:
                return sweepSeeds.get(sweepSlot);
            case RANDOM:
            default:
                return drawRandomSeeds ? Integer.toUnsignedLong(random.nextInt()) : BACKEND_RANDOM;
        }
    }

    int seedsPerCombination() {
        return mode == SeedMode.SWEEP ? sweepSeeds.size() : 1;
    }
}
