package work.pollochang.match.image.exception;

/**
 * 影像比對相關錯誤的共同父類別。
 * <p>
 * 所有子類別皆為 unchecked，由呼叫端依型別區分失敗原因。
 */
public class ImageMatchException extends RuntimeException {

    public ImageMatchException(String message) {
        super(message);
    }

    public ImageMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
