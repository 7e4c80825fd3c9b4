package work.pollochang.match.image;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.match.image.capture.RobotScreenCapture;
import work.pollochang.match.image.capture.ScreenCaptureProvider;
import work.pollochang.match.image.core.ImageMatcher;
import work.pollochang.match.image.core.ImageResource;
import work.pollochang.match.image.core.MatchConfig;
import work.pollochang.match.image.core.Region;
import work.pollochang.match.image.poll.PollController;
import work.pollochang.match.image.poll.WaitOptions;
import work.pollochang.match.image.report.MatchBounds;
import work.pollochang.match.image.report.MatchPoint;
import work.pollochang.match.image.report.MatchResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 非同步的螢幕樣板搜尋入口。所有搜尋都在工作執行緒上進行，呼叫端 (GUI 或自動化流程)
 * 拿到的是 {@link CompletableFuture}，失敗時以原本的例外結束 future。
 *
 * <pre>{@code
 * try (ImageFinder finder = ImageFinder.forScreen()) {
 *     ImageResource button = ImageResources.imageResourceSync(Path.of("ok.png"));
 *     MatchResult hit = finder.waitFor(button, WaitOptions.defaults().withTimeoutMs(5000)).join();
 *     MatchPoint click = ImageFinder.getMatchCenter(hit);
 * }
 * }</pre>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ImageFinder implements AutoCloseable {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ScreenCaptureProvider captureProvider;
    private final PollController pollController;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * 使用自己的固定大小執行緒池 (CPU 核心數)，{@link #close()} 時關閉。
     */
    public ImageFinder(ScreenCaptureProvider captureProvider) {
        this(captureProvider, newPool(), true);
    }

    /**
     * 使用外部提供的執行緒池，{@link #close()} 不會關閉它。
     */
    public ImageFinder(ScreenCaptureProvider captureProvider, ExecutorService executor) {
        this(captureProvider, Objects.requireNonNull(executor, "executor must not be null"), false);
    }

    private ImageFinder(ScreenCaptureProvider captureProvider, ExecutorService executor, boolean ownsExecutor) {
        this.captureProvider = Objects.requireNonNull(captureProvider, "captureProvider must not be null");
        this.pollController = new PollController(captureProvider);
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * 以 AWT {@code Robot} 擷取主螢幕。
     */
    public static ImageFinder forScreen() {
        return new ImageFinder(new RobotScreenCapture());
    }

    private static ExecutorService newPool() {
        int coreCount = Math.max(1, Runtime.getRuntime().availableProcessors());
        log.debug("建立固定大小為 {} 的比對執行緒池", coreCount);
        return Executors.newFixedThreadPool(coreCount);
    }

    public CompletableFuture<Optional<MatchResult>> findOnScreen(ImageResource template) {
        return findOnScreen(template, null);
    }

    public CompletableFuture<Optional<MatchResult>> findOnScreen(ImageResource template, MatchConfig config) {
        return submit(() -> ImageMatcher.find(captureProvider.captureScreen(), template, config));
    }

    public CompletableFuture<List<MatchResult>> findAllOnScreen(ImageResource template) {
        return findAllOnScreen(template, null);
    }

    public CompletableFuture<List<MatchResult>> findAllOnScreen(ImageResource template, MatchConfig config) {
        return submit(() -> ImageMatcher.findAll(captureProvider.captureScreen(), template, config));
    }

    public CompletableFuture<Optional<MatchResult>> findInRegion(ImageResource template, Region region) {
        return findInRegion(template, region, null);
    }

    /**
     * 只在畫面的 {@code region} 內搜尋，結果座標仍是整張畫面的絕對座標。
     */
    public CompletableFuture<Optional<MatchResult>> findInRegion(ImageResource template, Region region,
                                                                 MatchConfig config) {
        return submit(() -> ImageMatcher.findInRegion(captureProvider.captureScreen(), template, region, config));
    }

    public CompletableFuture<List<MatchResult>> findAllInRegion(ImageResource template, Region region) {
        return findAllInRegion(template, region, null);
    }

    public CompletableFuture<List<MatchResult>> findAllInRegion(ImageResource template, Region region,
                                                                MatchConfig config) {
        return submit(() -> ImageMatcher.findAllInRegion(captureProvider.captureScreen(), template, region, config));
    }

    /**
     * 等待樣板出現。逾時以 {@code MatchTimeoutException}、取消以 {@code MatchCancelledException} 結束 future。
     * 輪詢期間會佔用一條工作執行緒。
     */
    public CompletableFuture<MatchResult> waitFor(ImageResource template, WaitOptions options) {
        return submit(() -> pollController.waitFor(template, options));
    }

    public CompletableFuture<Void> waitForGone(ImageResource template, WaitOptions options) {
        return submit(() -> {
            pollController.waitForGone(template, options);
            return null;
        });
    }

    public static MatchPoint getMatchCenter(MatchResult match) {
        return match.center();
    }

    public static MatchBounds getMatchBounds(MatchResult match) {
        return match.bounds();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("比對執行緒池等待逾時，強制關閉。");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("比對執行緒池被中斷。", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
