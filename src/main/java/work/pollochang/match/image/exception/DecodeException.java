package work.pollochang.match.image.exception;

/**
 * 影像位元組無法解碼，或像素緩衝區長度與宣告的尺寸不符。
 */
public class DecodeException extends ImageMatchException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
