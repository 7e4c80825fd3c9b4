package work.pollochang.match.image.poll;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 合作式取消旗標。輪詢迴圈只在兩次搜尋之間檢查，單次搜尋不會被中斷；
 * 等待下一次輪詢的期間若被取消會立即醒來。
 */
public final class CancelToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public static CancelToken none() {
        return new CancelToken();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * 最多等待 {@code millis} 毫秒。
     *
     * @return 等待期間 (或之前) 已被取消
     */
    boolean awaitCancellation(long millis) throws InterruptedException {
        return cancelled.await(millis, TimeUnit.MILLISECONDS);
    }
}
