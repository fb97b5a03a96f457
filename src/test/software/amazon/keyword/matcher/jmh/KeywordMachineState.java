package software.amazon.keyword.matcher.jmh;

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import software.amazon.keyword.matcher.KeywordMachine;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@State(Scope.Benchmark)
public class KeywordMachineState {

    public static final int DATASET_SIZE = 1000;

    private static final String ALPHABET = "abcdefghij色情赌博敏感词";

    @Param({ "10", "1000", "10000" })
    public int keywordCount;

    public KeywordMachine machine;
    public final List<String> texts = new ArrayList<>();

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(42);
        KeywordMachine.Builder builder = KeywordMachine.builder();
        for (int i = 0; i < keywordCount; i++) {
            builder.addKeyword(randomString(random, 2 + random.nextInt(6)));
        }
        machine = builder.build();

        texts.clear();
        for (int i = 0; i < DATASET_SIZE; i++) {
            texts.add(randomString(random, 200));
        }
    }

    private static String randomString(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
