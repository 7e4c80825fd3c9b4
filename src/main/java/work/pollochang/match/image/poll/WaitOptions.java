package work.pollochang.match.image.poll;

import lombok.With;
import work.pollochang.match.image.core.MatchConfig;
import work.pollochang.match.image.core.Region;
import work.pollochang.match.image.exception.ValidationException;

/**
 * {@code waitFor} / {@code waitForGone} 的參數。
 *
 * @param region         搜尋區域，{@code null} 表示整張畫面
 * @param config         比對參數，{@code null} 表示預設值
 * @param pollIntervalMs 兩次搜尋之間的間隔 (毫秒)，必須大於 0
 * @param timeoutMs      最長等待時間 (毫秒)，不可為負
 * @param cancelToken    取消旗標，{@code null} 表示不可取消
 */
@With
public record WaitOptions(Region region, MatchConfig config, long pollIntervalMs, long timeoutMs,
                          CancelToken cancelToken) {

    public static final long DEFAULT_POLL_INTERVAL_MS = 100;
    public static final long DEFAULT_TIMEOUT_MS = 10_000;

    public static WaitOptions defaults() {
        return new WaitOptions(null, null, DEFAULT_POLL_INTERVAL_MS, DEFAULT_TIMEOUT_MS, null);
    }

    public MatchConfig effectiveConfig() {
        return config != null ? config : MatchConfig.defaults();
    }

    public CancelToken effectiveCancelToken() {
        return cancelToken != null ? cancelToken : CancelToken.none();
    }

    public void validate() {
        if (pollIntervalMs <= 0) {
            throw new ValidationException("pollIntervalMs 必須大於 0: " + pollIntervalMs);
        }
        if (timeoutMs < 0) {
            throw new ValidationException("timeoutMs 不可為負: " + timeoutMs);
        }
        effectiveConfig().validate();
    }
}
