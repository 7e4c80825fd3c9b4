package work.pollochang.match.image.exception;

/**
 * 設定值超出範圍，或搜尋區域不在畫面範圍內。
 */
public class ValidationException extends ImageMatchException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
