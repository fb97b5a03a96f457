package software.amazon.keyword.matcher;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Scenarios worked out by hand, plus a brute-force comparison on many small random keyword sets and texts.
 */
public class KeywordMachineTest {

    // the blocklist and sample texts of the keyword filter this library grew out of
    private static final List<String> BLOCKLIST = Arrays.asList(
            "色情", "赌博", "暴力", "毒品", "违法", "敏感词", "脏话", "不良信息");

    private static final Comparator<KeywordMatch> BY_POSITION = Comparator
            .comparingInt(KeywordMatch::getEndOffset)
            .thenComparingInt(KeywordMatch::getStartOffset)
            .thenComparing(KeywordMatch::getKeyword);

    private static KeywordMatch m(String keyword, int start, int end) {
        return new KeywordMatch(keyword, start, end);
    }

    // every occurrence, found the slow way
    private static List<KeywordMatch> bruteForce(Set<String> keywords, String text) {
        int[] symbols = text.codePoints().toArray();
        List<KeywordMatch> matches = new ArrayList<>();
        for (int end = 0; end < symbols.length; end++) {
            for (String keyword : keywords) {
                int[] k = keyword.codePoints().toArray();
                int start = end - k.length + 1;
                if (start < 0) {
                    continue;
                }
                boolean same = true;
                for (int i = 0; i < k.length && same; i++) {
                    same = symbols[start + i] == k[i];
                }
                if (same) {
                    matches.add(m(keyword, start, end));
                }
            }
        }
        return matches;
    }

    private static void assertOrderedByEnd(List<KeywordMatch> matches) {
        for (int i = 1; i < matches.size(); i++) {
            assertTrue("out of order at " + i + ": " + matches,
                    matches.get(i - 1).getEndOffset() <= matches.get(i).getEndOffset());
        }
    }

    private static List<KeywordMatch> sorted(List<KeywordMatch> matches) {
        List<KeywordMatch> copy = new ArrayList<>(matches);
        copy.sort(BY_POSITION);
        return copy;
    }

    @Test
    public void testTextbookExample() {
        KeywordMachine machine = KeywordMachine.of("a", "ab", "bc", "bca", "c", "caa");
        assertEquals(Arrays.asList(
                m("a", 0, 0),
                m("ab", 0, 1),
                m("bc", 1, 2),
                m("c", 2, 2),
                m("c", 3, 3),
                m("a", 4, 4),
                m("ab", 4, 5)),
                machine.search("abccab"));
    }

    @Test
    public void testHeSheHisHers() {
        KeywordMachine machine = KeywordMachine.of("he", "she", "his", "hers");
        assertEquals(Arrays.asList(
                m("his", 1, 3),
                m("she", 3, 5),
                m("he", 4, 5),
                m("hers", 4, 7)),
                machine.search("ahishers"));
    }

    @Test
    public void testOverlappingKeywordsAllReported() {
        KeywordMachine machine = KeywordMachine.of("aa", "aaa");
        assertEquals(Arrays.asList(
                m("aa", 0, 1),
                m("aaa", 0, 2),
                m("aa", 1, 2),
                m("aaa", 1, 3),
                m("aa", 2, 3)),
                machine.search("aaaa"));
    }

    @Test
    public void testKeywordEqualToWholeText() {
        KeywordMachine machine = KeywordMachine.of("needle");
        assertEquals(Collections.singletonList(m("needle", 0, 5)), machine.search("needle"));
    }

    @Test
    public void testNoKeywords() {
        KeywordMachine machine = KeywordMachine.of();
        assertTrue(machine.search("anything at all").isEmpty());
        assertTrue(machine.search("").isEmpty());
        assertFalse(machine.containsAny("anything at all"));
        assertEquals("anything at all", machine.redact("anything at all"));
        assertEquals(1, machine.getStateCount());
        assertTrue(machine.getKeywords().isEmpty());
    }

    @Test
    public void testEmptyText() {
        KeywordMachine machine = KeywordMachine.of("a");
        assertTrue(machine.search("").isEmpty());
        assertFalse(machine.findFirst("").isPresent());
        assertEquals("", machine.redact(""));
    }

    @Test
    public void testNoMatchLeavesTextAlone() {
        KeywordMachine machine = KeywordMachine.of("xyz");
        assertTrue(machine.search("xyxyxzyz").isEmpty());
        assertFalse(machine.containsAny("xyxyxzyz"));
        assertEquals("xyxyxzyz", machine.redact("xyxyxzyz"));
    }

    @Test
    public void testBlocklist() {
        KeywordMachine machine = KeywordMachine.of(BLOCKLIST);

        assertFalse(machine.containsAny("这是一段正常的文本内容"));

        assertEquals(Arrays.asList(m("色情", 4, 5), m("赌博", 7, 8)), machine.search("这里包含色情和赌博的内容"));
        assertEquals("这里包含**和**的内容", machine.redact("这里包含色情和赌博的内容"));

        assertEquals(Arrays.asList(m("毒品", 3, 4), m("暴力", 6, 7)), machine.search("请远离毒品和暴力"));

        assertTrue(machine.containsAny("小心违法的不良信息"));
        assertEquals(Arrays.asList(m("违法", 2, 3), m("不良信息", 5, 8)), machine.search("小心违法的不良信息"));
        assertEquals("小心**的****", machine.redact("小心违法的不良信息"));
    }

    @Test
    public void testLongTextWithSingleMatch() {
        KeywordMachine machine = KeywordMachine.of(BLOCKLIST);
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            text.append("这是一些正常的文本内容。");
        }
        int offset = text.codePointCount(0, text.length()) + 3;
        text.append("这里有色情内容");
        for (int i = 0; i < 100; i++) {
            text.append("更多正常文本。");
        }

        assertEquals(Collections.singletonList(m("色情", offset, offset + 1)), machine.search(text.toString()));
    }

    @Test
    public void testSupplementaryCodePointsCountOnce() {
        KeywordMachine machine = KeywordMachine.of("😀x", "x");
        assertEquals(Arrays.asList(m("😀x", 1, 2), m("x", 2, 2)), machine.search("a😀x"));
        assertEquals("a**", machine.redact("a😀x"));
    }

    @Test
    public void testMatchingIsCaseSensitive() {
        KeywordMachine machine = KeywordMachine.of("Spam");
        assertFalse(machine.containsAny("spam SPAM"));
        assertTrue(machine.containsAny("more Spam"));
    }

    @Test
    public void testDuplicateKeywordsReportedOnce() {
        KeywordMachine machine = KeywordMachine.of("ab", "ab", "b");
        assertEquals(Arrays.asList(m("ab", 0, 1), m("b", 1, 1)), machine.search("ab"));
        assertEquals(2, machine.getKeywords().size());
    }

    @Test
    public void testFindFirst() {
        KeywordMachine machine = KeywordMachine.of("he", "she", "his", "hers");
        Optional<KeywordMatch> first = machine.findFirst("ahishers");
        assertTrue(first.isPresent());
        assertEquals(m("his", 1, 3), first.get());
        assertEquals(machine.search("ahishers").get(0), first.get());

        // keywords ending at the same offset: the longest comes first
        assertEquals(m("she", 0, 2), machine.findFirst("she").get());
    }

    @Test
    public void testSearchResultIsUnmodifiable() {
        List<KeywordMatch> matches = KeywordMachine.of("a").search("aa");
        try {
            matches.clear();
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) { }
    }

    @Test
    public void testAgainstBruteForce() {
        Random random = new Random(20240521);
        for (int round = 0; round < 500; round++) {
            Set<String> keywords = new LinkedHashSet<>();
            int count = random.nextInt(8);
            for (int i = 0; i < count; i++) {
                keywords.add(randomString(random, 1 + random.nextInt(4)));
            }
            KeywordMachine machine = KeywordMachine.of(keywords);

            for (int t = 0; t < 10; t++) {
                String text = randomString(random, random.nextInt(30));
                List<KeywordMatch> actual = machine.search(text);
                List<KeywordMatch> expected = bruteForce(keywords, text);

                assertOrderedByEnd(actual);
                assertEquals("keywords " + keywords + " text " + text, sorted(expected), sorted(actual));
                assertEquals(!expected.isEmpty(), machine.containsAny(text));
            }
        }
    }

    private static String randomString(Random random, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            // mostly a tiny alphabet so keywords overlap, now and then a multi-byte character
            int pick = random.nextInt(10);
            if (pick == 0) {
                sb.append("词");
            } else if (pick == 1) {
                sb.append("😀");
            } else {
                sb.append((char) ('a' + random.nextInt(3)));
            }
        }
        return sb.toString();
    }

    @Test
    public void testBuilderIsSingleUse() {
        KeywordMachine.Builder builder = KeywordMachine.builder().addKeyword("a");
        KeywordMachine machine = builder.build();
        try {
            builder.build();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) { }
        try {
            builder.addKeyword("b");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) { }

        // the machine already handed out is unaffected
        assertEquals(Collections.singleton("a"), machine.getKeywords());
        assertEquals(Collections.singletonList(m("a", 1, 1)), machine.search("ba"));
    }

    @Test
    public void testEmptyKeywordRejectedByDefault() {
        KeywordMachine.Builder builder = KeywordMachine.builder().addKeyword("a");
        try {
            builder.addKeyword("");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) { }

        // the failed insertion did not damage what was added before
        KeywordMachine machine = builder.addKeyword("b").build();
        assertEquals(Arrays.asList(m("a", 0, 0), m("b", 1, 1)), machine.search("ab"));
    }

    @Test
    public void testEmptyKeywordsIgnoredWhenConfigured() {
        MachineConfiguration configuration = new MachineConfiguration.Builder()
                .withEmptyKeywordsIgnored(true)
                .build();
        KeywordMachine machine = KeywordMachine.builder(configuration)
                .addKeywords(Arrays.asList("", "a", "", "b"))
                .build();
        assertEquals(new LinkedHashSet<>(Arrays.asList("a", "b")), machine.getKeywords());
        assertEquals(3, machine.getStateCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullKeywordRejected() {
        KeywordMachine.builder().addKeyword(null);
    }

    @Test
    public void testConcurrentSearches() throws Exception {
        final KeywordMachine machine = KeywordMachine.of("he", "she", "his", "hers", "色情", "a", "aa");
        final String[] texts = { "ahishers", "这里有色情内容", "aaaa", "ushers", "nothing here", "" };
        final List<List<KeywordMatch>> expected = new ArrayList<>();
        for (String text : texts) {
            expected.add(machine.search(text));
        }

        final int threads = 8;
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);
        final AtomicInteger failures = new AtomicInteger();
        final CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int round = 0; round < 2000; round++) {
                        int i = round % texts.length;
                        if (!expected.get(i).equals(machine.search(texts[i]))) {
                            failures.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failures.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(0, failures.get());
    }

    @Test
    public void testToString() {
        assertEquals("KeywordMachine{keywords=2, states=4}", KeywordMachine.of("ab", "b").toString());
    }
}
