package work.pollochang.match.image;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.pollochang.match.image.core.ImageResource;
import work.pollochang.match.image.core.MatchConfig;
import work.pollochang.match.image.core.Region;
import work.pollochang.match.image.exception.CaptureException;
import work.pollochang.match.image.exception.MatchTimeoutException;
import work.pollochang.match.image.exception.ValidationException;
import work.pollochang.match.image.poll.WaitOptions;
import work.pollochang.match.image.report.MatchBounds;
import work.pollochang.match.image.report.MatchPoint;
import work.pollochang.match.image.report.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ImageFinderTest {

    private static final MatchConfig SINGLE_SCALE = MatchConfig.defaults().withSearchMultipleScales(false);

    private final ImageResource template = ImageFixtures.solid(12, 12, 30, 200, 90);
    private ImageResource screen;
    private ImageFinder finder;

    @BeforeEach
    void setUp() {
        screen = ImageFixtures.noise(160, 120, 1L);
        ImageFixtures.stamp(screen, template, 20, 30);
        ImageFixtures.stamp(screen, template, 120, 90);
        finder = new ImageFinder(() -> screen);
    }

    @AfterEach
    void tearDown() {
        finder.close();
    }

    @Test
    void testFindOnScreen() throws Exception {
        Optional<MatchResult> hit = finder.findOnScreen(template).get(10, TimeUnit.SECONDS);

        assertTrue(hit.isPresent());
        assertEquals(20, hit.get().x());
        assertEquals(30, hit.get().y());
    }

    /**
     * 結果依信心分數排列，數量不超過 limit
     */
    @Test
    void testFindAllOnScreen_ShouldBeSortedAndLimited() throws Exception {
        List<MatchResult> all = finder.findAllOnScreen(template).get(10, TimeUnit.SECONDS);
        List<MatchResult> one = finder.findAllOnScreen(template, MatchConfig.defaults().withLimit(1)).get(10, TimeUnit.SECONDS);

        assertEquals(2, all.size());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).confidence() >= all.get(i).confidence());
        }
        assertEquals(1, one.size());
    }

    @Test
    void testFindInRegion_ShouldUseAbsoluteCoordinates() throws Exception {
        Region lowerRight = new Region(80, 60, 80, 60);

        MatchResult hit = finder.findInRegion(template, lowerRight, SINGLE_SCALE).get(10, TimeUnit.SECONDS).orElseThrow();
        List<MatchResult> all = finder.findAllInRegion(template, lowerRight).get(10, TimeUnit.SECONDS);

        assertEquals(120, hit.x());
        assertEquals(90, hit.y());
        assertEquals(List.of(hit), all);
        assertTrue(finder.findInRegion(template, new Region(0, 0, 15, 15)).get(10, TimeUnit.SECONDS).isEmpty());
    }

    /**
     * 失敗時 future 以原本的例外結束
     */
    @Test
    void testInvalidRegion_ShouldFailFutureWithValidationException() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> finder.findAllInRegion(template, new Region(150, 100, 20, 20)).get(10, TimeUnit.SECONDS));

        assertInstanceOf(ValidationException.class, e.getCause());
    }

    @Test
    void testCaptureFailure_ShouldFailFutureWithCaptureException() {
        try (ImageFinder broken = new ImageFinder(() -> {
            throw new CaptureException("沒有螢幕");
        })) {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> broken.findOnScreen(template).get(10, TimeUnit.SECONDS));
            assertInstanceOf(CaptureException.class, e.getCause());
        }
    }

    @Test
    void testWaitForAndWaitForGone() throws Exception {
        MatchResult hit = finder.waitFor(template, WaitOptions.defaults().withTimeoutMs(1_000)).get(10, TimeUnit.SECONDS);
        assertEquals(20, hit.x());

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> finder.waitForGone(template, WaitOptions.defaults().withPollIntervalMs(20).withTimeoutMs(100))
                        .get(10, TimeUnit.SECONDS));
        assertInstanceOf(MatchTimeoutException.class, e.getCause());

        ImageResource other = ImageFixtures.solid(12, 12, 1, 1, 1);
        assertNull(finder.waitForGone(other, WaitOptions.defaults().withTimeoutMs(0)).get(10, TimeUnit.SECONDS));
    }

    @Test
    void testMatchCenterAndBounds() {
        MatchResult match = new MatchResult(10, 20, 51, 31, 0.9, 1.0);

        assertEquals(new MatchPoint(36, 36), ImageFinder.getMatchCenter(match));
        assertEquals(new MatchBounds(10, 20, 61, 51), ImageFinder.getMatchBounds(match));
    }

    /**
     * 外部提供的執行緒池不會被關閉
     */
    @Test
    void testClose_ShouldNotShutDownInjectedExecutor() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            ImageFinder shared = new ImageFinder(() -> screen, executor);
            assertTrue(shared.findOnScreen(template, SINGLE_SCALE).get(10, TimeUnit.SECONDS).isPresent());
            shared.close();

            assertFalse(executor.isShutdown());
        } finally {
            executor.shutdownNow();
        }
    }
}
