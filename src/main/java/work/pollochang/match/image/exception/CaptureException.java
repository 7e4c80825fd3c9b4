package work.pollochang.match.image.exception;

/**
 * 螢幕擷取失敗，原樣向上傳遞給呼叫端。
 */
public class CaptureException extends ImageMatchException {

    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
