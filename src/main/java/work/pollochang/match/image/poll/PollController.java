package work.pollochang.match.image.poll;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.match.image.capture.ScreenCaptureProvider;
import work.pollochang.match.image.core.ImageMatcher;
import work.pollochang.match.image.core.ImageResource;
import work.pollochang.match.image.core.MatchConfig;
import work.pollochang.match.image.core.Region;
import work.pollochang.match.image.exception.CaptureException;
import work.pollochang.match.image.exception.MatchCancelledException;
import work.pollochang.match.image.exception.MatchTimeoutException;
import work.pollochang.match.image.report.MatchResult;

import java.util.Objects;
import java.util.Optional;

/**
 * 反覆擷取畫面並搜尋樣板，直到出現 ({@link #waitFor}) 或消失 ({@link #waitForGone})。
 *
 * <p>狀態轉移為 {@code POLLING -> FOUND | TIMED_OUT | CANCELLED}，三個結束狀態互斥：
 * <ol>
 *   <li>檢查取消旗標，已取消則結束於 CANCELLED。</li>
 *   <li>擷取一張新畫面並做一次單筆搜尋。</li>
 *   <li>條件成立則結束於 FOUND。</li>
 *   <li>已經過時間不小於 timeout 則結束於 TIMED_OUT。</li>
 *   <li>等待 pollInterval (期間若被取消會立即醒來) 後重複。</li>
 * </ol>
 * 每次呼叫都會阻塞目前執行緒，非同步版本請使用 {@code ImageFinder}。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class PollController {

    private final ScreenCaptureProvider captureProvider;

    public PollController(ScreenCaptureProvider captureProvider) {
        this.captureProvider = Objects.requireNonNull(captureProvider, "captureProvider must not be null");
    }

    /**
     * 等待樣板出現。
     *
     * @return 第一次找到的結果
     * @throws MatchTimeoutException   超過 timeout 仍未找到
     * @throws MatchCancelledException 在找到或逾時之前被取消
     * @throws CaptureException        擷取畫面失敗
     */
    public MatchResult waitFor(ImageResource template, WaitOptions options) {
        return poll(template, options, false)
                .orElseThrow(() -> new IllegalStateException("waitFor 結束時沒有結果"));
    }

    /**
     * 等待樣板從畫面上消失。
     *
     * @throws MatchTimeoutException   超過 timeout 仍然存在
     * @throws MatchCancelledException 在消失或逾時之前被取消
     * @throws CaptureException        擷取畫面失敗
     */
    public void waitForGone(ImageResource template, WaitOptions options) {
        poll(template, options, true);
    }

    private Optional<MatchResult> poll(ImageResource template, WaitOptions options, boolean untilGone) {
        Objects.requireNonNull(template, "template must not be null");
        WaitOptions effective = options == null ? WaitOptions.defaults() : options;
        effective.validate();
        MatchConfig config = effective.effectiveConfig();
        CancelToken token = effective.effectiveCancelToken();
        String goal = untilGone ? "消失" : "出現";

        long start = System.nanoTime();
        int attempts = 0;
        PollState state = PollState.POLLING;
        log.debug("開始等待樣板 {} {} (間隔 {} ms，逾時 {} ms)",
                template, goal, effective.pollIntervalMs(), effective.timeoutMs());
        try {
            while (true) {
                if (token.isCancelled()) {
                    state = PollState.CANCELLED;
                    throw new MatchCancelledException("等待樣板" + goal + "已取消 (第 " + attempts + " 次輪詢後)");
                }
                ImageResource screen = captureProvider.captureScreen();
                Region region = effective.region() != null ? effective.region() : Region.of(screen);
                Optional<MatchResult> hit = ImageMatcher.findInRegion(screen, template, region, config);
                attempts++;
                long elapsed = elapsedMillis(start);
                log.trace("第 {} 次輪詢: {}，已經過 {} ms", attempts, hit.map(Object::toString).orElse("未找到"), elapsed);

                if (untilGone ? hit.isEmpty() : hit.isPresent()) {
                    state = PollState.FOUND;
                    return hit;
                }
                if (elapsed >= effective.timeoutMs()) {
                    state = PollState.TIMED_OUT;
                    throw new MatchTimeoutException("等待樣板" + goal + "逾時 (" + elapsed + " ms，" + attempts + " 次輪詢)",
                            effective.timeoutMs());
                }
                long sleep = Math.min(effective.pollIntervalMs(), effective.timeoutMs() - elapsed);
                if (token.awaitCancellation(sleep)) {
                    state = PollState.CANCELLED;
                    throw new MatchCancelledException("等待樣板" + goal + "已取消 (第 " + attempts + " 次輪詢後)");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state = PollState.CANCELLED;
            throw new MatchCancelledException("等待樣板" + goal + "時執行緒被中斷");
        } finally {
            log.info("等待樣板 {} {} 結束: {} ({} 次輪詢，{} ms)",
                    template, goal, state.getDescription(), attempts, elapsedMillis(start));
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
