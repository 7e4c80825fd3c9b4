package work.pollochang.match.image.capture;

import work.pollochang.match.image.core.ImageResource;
import work.pollochang.match.image.exception.CaptureException;

/**
 * 提供目前畫面的擷取結果。
 */
@FunctionalInterface
public interface ScreenCaptureProvider {

    /**
     * 擷取整張畫面。
     *
     * @return 畫面像素
     * @throws CaptureException 擷取失敗，會原樣傳遞給呼叫端
     */
    ImageResource captureScreen();
}
